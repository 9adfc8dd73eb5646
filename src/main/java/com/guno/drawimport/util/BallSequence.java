package com.guno.drawimport.util;

import com.guno.drawimport.entity.DrawRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Balls read from a run of numeric tokens: the first 20 distinct in-range values in source
 * order, plus the in-range token that follows them. That trailing token is the super number
 * candidate and may repeat one of the balls.
 */
@Value
public class BallSequence {

    List<Integer> balls;
    Integer trailing;

    public static BallSequence of(List<String> runs) {
        List<Integer> balls = new ArrayList<>();
        Integer trailing = null;
        for (String run : runs) {
            Integer value = NumericTokens.asBall(run).orElse(null);
            if (value == null) continue;

            if (balls.size() == DrawRecord.BALL_COUNT) {
                trailing = value;
                break;
            }
            if (!balls.contains(value)) balls.add(value);
        }
        return new BallSequence(List.copyOf(balls), trailing);
    }

    public static BallSequence empty() {
        return new BallSequence(List.of(), null);
    }

    public boolean isFull() {
        return balls.size() == DrawRecord.BALL_COUNT;
    }

    /**
     * Balls then the trailing token, space separated, so the sequence survives a round through
     * the normalizer's token scan.
     */
    public String toTokenString() {
        StringBuilder sb = new StringBuilder();
        for (Integer b : balls) sb.append(sb.length() == 0 ? "" : " ").append(b);
        if (trailing != null) sb.append(' ').append(trailing);
        return sb.toString();
    }
}
