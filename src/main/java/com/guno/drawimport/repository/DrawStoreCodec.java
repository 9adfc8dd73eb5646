package com.guno.drawimport.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.drawimport.dto.internal.StoredDrawDto;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.exception.InvalidDrawRecordException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps between {@link DrawStore} and its serialized form: an ascending array of
 * {@code {period, date, balls, super}}. The compact JSON of a store is its canonical form;
 * two stores are "the same" iff their canonical forms are equal.
 */
@Component
@RequiredArgsConstructor
public class DrawStoreCodec {

    private final ObjectMapper objectMapper;

    public List<StoredDrawDto> toDtos(DrawStore store) {
        return store.toList().stream().map(DrawStoreCodec::toDto).collect(Collectors.toList());
    }

    public String toCanonicalJson(DrawStore store) {
        try {
            return objectMapper.writeValueAsString(toDtos(store));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize draw store", e);
        }
    }

    public String toPrettyJson(DrawStore store) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDtos(store));
    }

    public static StoredDrawDto toDto(DrawRecord record) {
        return StoredDrawDto.builder()
                .period(record.getPeriod())
                .date(record.getDate() != null ? record.getDate().toString() : "")
                .balls(record.getBalls())
                .superNumber(record.getSuperNumber())
                .build();
    }

    /**
     * @throws InvalidDrawRecordException when the entry breaks the record rules or has an
     *                                    unparseable date
     */
    public static DrawRecord fromDto(StoredDrawDto dto) {
        LocalDate date = null;
        String rawDate = dto.getDate();
        if (rawDate != null && !rawDate.isBlank()) {
            try {
                date = LocalDate.parse(rawDate.trim());
            } catch (DateTimeParseException e) {
                throw new InvalidDrawRecordException("bad date for period " + dto.getPeriod() + ": " + rawDate, e);
            }
        }
        return DrawRecord.of(dto.getPeriod(), date, dto.getBalls(), dto.getSuperNumber());
    }
}
