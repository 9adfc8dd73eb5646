package com.guno.drawimport.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.drawimport.config.DrawSourceProperties;
import com.guno.drawimport.dto.internal.ErrorReport;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.util.BallSequence;
import com.guno.drawimport.util.NumericTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DrawRecordNormalizer - maps one heterogeneous raw item to a {@link DrawRecord}
 *
 * Field resolution is table driven: each logical field has an ordered list of source keys
 * and a coercion. Ball list fallbacks, in order: 20 numbered slot fields, then a scan of
 * every numeric token in the item's string and array values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DrawRecordNormalizer {

    static final FieldRule<String> PERIOD = FieldRule.of("period",
            List.of("drawTerm", "period", "term", "issue", "drawNo", "periodNo"),
            node -> NumericTokens.firstDigitRun(text(node)));

    static final FieldRule<LocalDate> DATE = FieldRule.of("date",
            List.of("openDate", "drawDate", "lotteryDate", "dDate", "date"),
            node -> parseDate(text(node)));

    static final FieldRule<BallSequence> BALLS = FieldRule.of("balls",
            List.of("openShowOrder", "bigShowOrder", "winNo", "winningNumbers", "numbers", "balls", "drawNumbers"),
            node -> {
                BallSequence sequence = BallSequence.of(digitRuns(node));
                return sequence.isFull() ? Optional.of(sequence) : Optional.empty();
            });

    static final FieldRule<Integer> SUPER = FieldRule.of("super",
            List.of("superNo", "starNo", "superNumber", "starNumber", "bullEyeTop", "super", "superBall"),
            node -> NumericTokens.firstBall(text(node)));

    static final List<String> SLOT_PREFIXES = List.of("no", "ball", "num", "n", "b");

    private final DrawSourceProperties properties;

    public NormalizationResult normalize(JsonNode item, LocalDate fallbackDate) {
        Optional<FieldRule.Match<String>> period = PERIOD.resolve(item);
        if (period.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.EMPTY_PERIOD, null, "No period field");
        }
        String periodValue = period.get().getValue();

        Optional<FieldRule.Match<LocalDate>> date = DATE.resolve(item);
        Optional<FieldRule.Match<Integer>> explicitSuper = SUPER.resolve(item);

        BallSequence sequence = BALLS.resolve(item)
                .map(FieldRule.Match::getValue)
                .or(() -> fromSlots(item))
                .orElseGet(() -> scanTokens(item, consumedKeys(period, date, explicitSuper)));

        if (!sequence.isFull()) {
            return NormalizationResult.rejected(RejectionReason.INSUFFICIENT_BALLS, periodValue,
                    "Only " + sequence.getBalls().size() + " distinct valid balls");
        }

        Integer superNumber = explicitSuper.map(FieldRule.Match::getValue)
                .orElseGet(() -> fallbackSuper(sequence));

        DrawRecord record = DrawRecord.of(
                periodValue,
                date.map(FieldRule.Match::getValue).orElse(fallbackDate),
                sequence.getBalls(),
                superNumber);
        return NormalizationResult.accepted(record);
    }

    /**
     * Normalize a page of rows. Rejected rows are dropped and reported; the batch goes on.
     */
    public NormalizedBatch normalizeAll(List<JsonNode> rows, LocalDate fallbackDate, String source) {
        NormalizedBatch batch = new NormalizedBatch();
        for (JsonNode row : rows) {
            NormalizationResult result = normalize(row, fallbackDate);
            if (result.isAccepted()) {
                batch.getRecords().add(result.getRecord());
            } else {
                log.debug("Dropped {} item (period: {}): {} - {}",
                        source, result.getPeriod(), result.getReason(), result.getDetail());
                batch.getRejections().add(ErrorReport.rejection(source, result.getPeriod(),
                        result.getReason().name(), result.getDetail()));
            }
        }

        if (!batch.getRejections().isEmpty()) {
            log.warn("{} of {} {} items rejected during normalization",
                    batch.getRejections().size(), rows.size(), source);
        }
        return batch;
    }

    /**
     * The token after the 20th distinct ball, repeats included; otherwise the configured fallback.
     */
    private Integer fallbackSuper(BallSequence sequence) {
        if (sequence.getTrailing() != null) {
            return sequence.getTrailing();
        }
        if (properties.getNormalize().getSuperFallback() == SuperFallback.LAST_BALL) {
            return sequence.getBalls().get(DrawRecord.BALL_COUNT - 1);
        }
        return null;
    }

    // ========== BALL LIST FALLBACKS ==========

    private static Optional<BallSequence> fromSlots(JsonNode item) {
        if (item == null || !item.isObject()) return Optional.empty();

        for (String prefix : SLOT_PREFIXES) {
            List<String> runs = new ArrayList<>();
            for (int i = 1; i <= DrawRecord.BALL_COUNT; i++) {
                JsonNode slot = slot(item, prefix, i);
                if (slot == null) break;
                NumericTokens.firstDigitRun(text(slot)).ifPresent(runs::add);
            }

            BallSequence balls = BallSequence.of(runs);
            if (balls.isFull()) {
                return Optional.of(balls);
            }
        }
        return Optional.empty();
    }

    private static JsonNode slot(JsonNode item, String prefix, int index) {
        for (String key : List.of(prefix + index, prefix + String.format("%02d", index), prefix + "_" + index)) {
            JsonNode v = item.get(key);
            if (v != null && !v.isNull()) return v;
        }
        return null;
    }

    private static BallSequence scanTokens(JsonNode item, Set<String> skipKeys) {
        if (item == null || !item.isObject()) return BallSequence.empty();

        List<String> runs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (skipKeys.contains(e.getKey())) continue;

            JsonNode v = e.getValue();
            if (v.isTextual() || v.isArray()) {
                runs.addAll(digitRuns(v));
            }
        }
        return BallSequence.of(runs);
    }

    private static Set<String> consumedKeys(Optional<FieldRule.Match<String>> period,
                                            Optional<FieldRule.Match<LocalDate>> date,
                                            Optional<FieldRule.Match<Integer>> superNumber) {
        Set<String> keys = new HashSet<>();
        period.ifPresent(m -> keys.add(m.getSourceKey()));
        date.ifPresent(m -> keys.add(m.getSourceKey()));
        superNumber.ifPresent(m -> keys.add(m.getSourceKey()));
        return keys;
    }

    // ========== COERCION HELPERS ==========

    static String text(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isIntegralNumber()) return node.bigIntegerValue().toString();
        if (node.isValueNode()) return node.asText();
        return null;
    }

    /**
     * Digit runs of a value in document order; arrays and objects are walked recursively.
     */
    static List<String> digitRuns(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        if (node.isContainerNode()) {
            List<String> runs = new ArrayList<>();
            node.forEach(child -> runs.addAll(digitRuns(child)));
            return runs;
        }
        return NumericTokens.digitRuns(text(node));
    }

    /**
     * Accepts yyyy-MM-dd, yyyy/MM/dd, yyyyMMdd, ISO date-times and Minguo years (114/08/19).
     */
    static Optional<LocalDate> parseDate(String text) {
        List<String> runs = NumericTokens.digitRuns(text);
        if (runs.isEmpty()) return Optional.empty();

        try {
            String first = runs.get(0);
            if (first.length() == 8) {
                return Optional.of(LocalDate.of(
                        Integer.parseInt(first.substring(0, 4)),
                        Integer.parseInt(first.substring(4, 6)),
                        Integer.parseInt(first.substring(6, 8))));
            }
            if (runs.size() < 3 || first.length() > 4) return Optional.empty();

            int year = Integer.parseInt(first);
            if (year < 1000) year += 1911;
            return Optional.of(LocalDate.of(year, Integer.parseInt(runs.get(1)), Integer.parseInt(runs.get(2))));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
