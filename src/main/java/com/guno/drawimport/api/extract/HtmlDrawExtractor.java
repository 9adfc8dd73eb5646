package com.guno.drawimport.api.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guno.drawimport.util.BallSequence;
import com.guno.drawimport.util.NumericTokens;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * HtmlDrawExtractor - lower-confidence extractor for the HTML result pages.
 *
 * <p>Produces raw items ({@code period}, {@code date}, {@code numbers}) in the same shape the
 * API rows have, so they go through the regular normalizer. The structural pass looks for the
 * smallest elements whose text holds a period-like token and at least 20 ball tokens. When the
 * markup gives no such region, the flattened page text is segmented at every period token.
 * Within one document the first occurrence of a period wins.
 */
@Component
@Slf4j
public class HtmlDrawExtractor {

    static final int PERIOD_MIN_DIGITS = 8;
    static final int PERIOD_MAX_DIGITS = 10;

    /** Gregorian or Minguo year with month and day; two-digit years only with 年/月. */
    private static final Pattern DATE = Pattern.compile(
            "(?<!\\d)(?:\\d{3,4}\\s*[-/.年]\\s*\\d{1,2}\\s*[-/.月]|\\d{2}\\s*年\\s*\\d{1,2}\\s*月)"
                    + "\\s*\\d{1,2}(?!\\d)\\s*日?");
    private static final Pattern TIME = Pattern.compile("\\d{1,2}:\\d{2}(?::\\d{2})?");

    public List<JsonNode> extractItems(String html) {
        if (html == null || html.isBlank()) return List.of();

        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, template").remove();
        // adjacent inline cells must not merge into one digit run
        for (Element el : doc.body().getAllElements()) {
            if (el != doc.body()) el.after(new TextNode(" "));
        }

        List<ObjectNode> items = structuralPass(doc.body());
        if (items.isEmpty()) {
            log.debug("No structural draw regions - falling back to text segmentation");
            items = textualPass(doc.body().text());
        }

        Map<String, ObjectNode> firstByPeriod = new LinkedHashMap<>();
        for (ObjectNode item : items) {
            firstByPeriod.putIfAbsent(item.get("period").asText(), item);
        }

        log.debug("HTML extraction found {} candidate draws", firstByPeriod.size());
        return new ArrayList<>(firstByPeriod.values());
    }

    // ========== STRUCTURAL PASS ==========

    private List<ObjectNode> structuralPass(Element body) {
        if (body == null) return List.of();

        List<ObjectNode> out = new ArrayList<>();
        for (Element el : body.getAllElements()) {
            if (!qualifies(el.text())) continue;

            boolean childQualifies = el.children().stream().anyMatch(c -> qualifies(c.text()));
            if (childQualifies) continue;

            out.addAll(regionItems(el.text()));
        }
        return out;
    }

    private List<ObjectNode> regionItems(String text) {
        List<String> periods = periodTokens(stripDatesAndTimes(text));
        if (periods.size() != 1) {
            // flat markup with several draws in one element
            return textualPass(text);
        }

        ObjectNode item = JsonNodeFactory.instance.objectNode();
        item.put("period", periods.get(0));

        Matcher dm = DATE.matcher(text);
        if (dm.find()) item.put("date", dm.group());

        item.put("numbers", ballSequence(stripDatesAndTimes(text)).toTokenString());
        return List.of(item);
    }

    private boolean qualifies(String text) {
        if (text == null || text.isEmpty()) return false;
        String cleaned = stripDatesAndTimes(text);
        return !periodTokens(cleaned).isEmpty()
                && ballSequence(cleaned).isFull();
    }

    // ========== TEXTUAL PASS ==========

    /**
     * Walk the digit runs in order; a period token opens a new draw and the runs up to the next
     * period make up its balls and trailing super token. A draw with fewer than 20 distinct
     * balls is discarded.
     */
    List<ObjectNode> textualPass(String text) {
        List<ObjectNode> out = new ArrayList<>();
        String currentPeriod = null;
        List<String> runs = new ArrayList<>();

        for (String run : NumericTokens.digitRuns(stripDatesAndTimes(text))) {
            if (isPeriodToken(run)) {
                flush(out, currentPeriod, runs);
                currentPeriod = run;
                runs = new ArrayList<>();
            } else if (currentPeriod != null) {
                runs.add(run);
            }
        }
        flush(out, currentPeriod, runs);
        return out;
    }

    private static void flush(List<ObjectNode> out, String period, List<String> runs) {
        if (period == null) return;

        BallSequence sequence = BallSequence.of(runs);
        if (!sequence.isFull()) return;

        ObjectNode item = JsonNodeFactory.instance.objectNode();
        item.put("period", period);
        item.put("numbers", sequence.toTokenString());
        out.add(item);
    }

    // ========== TOKEN HELPERS ==========

    private static List<String> periodTokens(String text) {
        return NumericTokens.digitRuns(text).stream()
                .filter(HtmlDrawExtractor::isPeriodToken)
                .distinct()
                .collect(Collectors.toList());
    }

    private static BallSequence ballSequence(String text) {
        return BallSequence.of(NumericTokens.digitRuns(text));
    }

    static boolean isPeriodToken(String run) {
        return run.length() >= PERIOD_MIN_DIGITS && run.length() <= PERIOD_MAX_DIGITS;
    }

    private static String stripDatesAndTimes(String text) {
        return DATE.matcher(stripTimes(text)).replaceAll(" ");
    }

    private static String stripTimes(String text) {
        return TIME.matcher(text).replaceAll(" ");
    }
}
