package com.guno.drawimport.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.StoredDrawDto;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.exception.InvalidDrawRecordException;
import com.guno.drawimport.exception.StoreWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON file store - one pretty-printed array, ascending by period
 *
 * Writes go to a temp file in the same directory which is then moved over the target, so a
 * crash mid-write leaves the previous file intact.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JsonFileDrawStoreRepository implements DrawStoreRepository {

    private final DrawSourceProperties properties;
    private final ObjectMapper objectMapper;
    private final DrawStoreCodec codec;

    @Override
    public DrawStore load() {
        Path path = storePath();
        if (!Files.exists(path)) {
            log.info("📂 No store at {} - starting empty", path);
            return DrawStore.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("⚠️ Store {} unreadable, treating as empty: {}", path, e.getMessage());
            return DrawStore.empty();
        }

        if (root == null || !root.isArray()) {
            log.warn("⚠️ Store {} is not a JSON array, treating as empty", path);
            return DrawStore.empty();
        }

        List<DrawRecord> records = new ArrayList<>();
        int skipped = 0;
        for (JsonNode entry : root) {
            try {
                records.add(DrawStoreCodec.fromDto(objectMapper.treeToValue(entry, StoredDrawDto.class)));
            } catch (JsonProcessingException | InvalidDrawRecordException e) {
                skipped++;
                log.warn("⚠️ Skipping stored entry {}: {}", entry.path("period").asText("?"), e.getMessage());
            }
        }

        DrawStore store = DrawStore.of(records);
        log.info("📂 Loaded {} draws from {} ({} skipped, max period: {})",
                store.size(), path, skipped, store.maxPeriod().orElse("-"));
        return store;
    }

    @Override
    public void save(DrawStore store) {
        Path target = storePath().toAbsolutePath();
        Path temp = null;
        try {
            Path dir = target.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, codec.toPrettyJson(store) + System.lineSeparator(), StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            log.info("💾 Wrote {} draws -> {}", store.size(), target);
        } catch (IOException e) {
            StoreWriteException failure = new StoreWriteException("Cannot write draw store " + target, target, e);
            deleteQuietly(temp, failure);
            throw failure;
        }
    }

    public Path storePath() {
        return Paths.get(properties.getStore().getPath());
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, StoreWriteException failure) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
