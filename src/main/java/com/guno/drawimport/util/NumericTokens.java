package com.guno.drawimport.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ASCII digit-run extraction shared by the JSON normalizer and the HTML extractor.
 * Surrounding punctuation, whitespace and non-ASCII text are ignored.
 */
@UtilityClass
public class NumericTokens {

    public static final int MIN_BALL = 1;
    public static final int MAX_BALL = 80;

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    /**
     * All digit runs of the text, in order, as strings (leading zeros kept).
     */
    public static List<String> digitRuns(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<String> out = new ArrayList<>();
        Matcher m = DIGITS.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    public static Optional<String> firstDigitRun(String text) {
        List<String> runs = digitRuns(text);
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
    }

    /**
     * Parse a digit run as a ball value; runs longer than two digits after leading zeros are
     * never balls.
     */
    public static Optional<Integer> asBall(String run) {
        if (run == null) return Optional.empty();
        String t = stripLeadingZeros(run);
        if (t.isEmpty() || t.length() > 2) return Optional.empty();

        int v = Integer.parseInt(t);
        return isBall(v) ? Optional.of(v) : Optional.empty();
    }

    /**
     * First digit run of the text that is a valid ball.
     */
    public static Optional<Integer> firstBall(String text) {
        for (String run : digitRuns(text)) {
            Optional<Integer> ball = asBall(run);
            if (ball.isPresent()) return ball;
        }
        return Optional.empty();
    }

    public static boolean isBall(int value) {
        return value >= MIN_BALL && value <= MAX_BALL;
    }

    public static boolean isAllDigits(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    public static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
        return digits.substring(i);
    }
}
