package com.guno.drawimport.processor;

import com.guno.drawimport.dto.internal.MergeResult;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.repository.DrawStoreCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeMap;

/**
 * DrawReconciler - folds freshly acquired records into the existing store
 *
 * Rules per incoming record:
 * - period absent: insert
 * - stored incomplete, incoming complete: replace (upgrade)
 * - both complete and different: keep the stored one, count a conflict
 * - anything else: ignore
 * A complete entry is therefore never downgraded, and merging the same batch twice is a no-op.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DrawReconciler {

    private final DrawStoreCodec codec;

    public MergeResult reconcile(DrawStore existing, List<DrawRecord> incoming) {
        TreeMap<String, DrawRecord> merged = existing.mutableCopy();
        int added = 0;
        int upgraded = 0;
        int conflicts = 0;
        int ignored = 0;

        for (DrawRecord record : incoming) {
            DrawRecord stored = merged.get(record.getPeriod());

            if (stored == null) {
                merged.put(record.getPeriod(), record);
                added++;
            } else if (!stored.isComplete() && record.isComplete()) {
                merged.put(record.getPeriod(), record);
                upgraded++;
                log.debug("Period {} upgraded with super number {}", record.getPeriod(), record.getSuperNumber());
            } else if (stored.isComplete() && record.isComplete() && !stored.equals(record)) {
                conflicts++;
                log.warn("⚠️ Conflicting draw for period {}: stored {} + {}, incoming {} + {} - keeping stored",
                        record.getPeriod(), stored.getBalls(), stored.getSuperNumber(),
                        record.getBalls(), record.getSuperNumber());
            } else {
                ignored++;
            }
        }

        DrawStore result = DrawStore.fromSorted(merged);
        boolean changed = !codec.toCanonicalJson(existing).equals(codec.toCanonicalJson(result));

        log.info("🔀 Merge: {} incoming -> {} added, {} upgraded, {} conflicts, {} unchanged (store {} -> {})",
                incoming.size(), added, upgraded, conflicts, ignored, existing.size(), result.size());

        return MergeResult.builder()
                .store(changed ? result : existing)
                .changed(changed)
                .added(added)
                .upgraded(upgraded)
                .conflicts(conflicts)
                .ignored(ignored)
                .build();
    }
}
