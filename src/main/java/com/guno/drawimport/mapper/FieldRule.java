package com.guno.drawimport.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One logical field: the source keys to try, in priority order, and how to coerce a value.
 * The first key whose value coerces wins.
 */
@Value
public class FieldRule<T> {

    String field;
    List<String> sourceKeys;
    Function<JsonNode, Optional<T>> coercion;

    public static <T> FieldRule<T> of(String field, List<String> sourceKeys, Function<JsonNode, Optional<T>> coercion) {
        return new FieldRule<>(field, List.copyOf(sourceKeys), coercion);
    }

    public Optional<Match<T>> resolve(JsonNode item) {
        if (item == null || !item.isObject()) return Optional.empty();

        for (String key : sourceKeys) {
            JsonNode value = item.get(key);
            if (value == null || value.isNull()) continue;

            Optional<T> coerced = coercion.apply(value);
            if (coerced.isPresent()) {
                return Optional.of(new Match<>(key, coerced.get()));
            }
        }
        return Optional.empty();
    }

    @Value
    public static class Match<T> {
        String sourceKey;
        T value;
    }
}
