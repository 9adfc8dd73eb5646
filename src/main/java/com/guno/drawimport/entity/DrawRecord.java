package com.guno.drawimport.entity;

import com.guno.drawimport.exception.InvalidDrawRecordException;
import com.guno.drawimport.util.NumericTokens;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * DrawRecord - one Bingo draw, keyed by period.
 *
 * <p>Instances always hold exactly 20 distinct balls in 1..80, stored ascending. The super
 * number and the date are optional. Use {@link #of} to build one; it refuses anything that
 * breaks those rules.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DrawRecord {

    public static final int BALL_COUNT = 20;

    String period;
    LocalDate date;
    List<Integer> balls;
    Integer superNumber;

    public static DrawRecord of(String period, LocalDate date, Collection<Integer> balls, Integer superNumber) {
        if (period == null || period.isBlank()) {
            throw new InvalidDrawRecordException("period is required");
        }
        if (balls == null) {
            throw new InvalidDrawRecordException("balls are required for period " + period);
        }

        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer b : balls) {
            if (b == null || !NumericTokens.isBall(b)) {
                throw new InvalidDrawRecordException("ball out of range for period " + period + ": " + b);
            }
            sorted.add(b);
        }
        if (sorted.size() != BALL_COUNT || balls.size() != BALL_COUNT) {
            throw new InvalidDrawRecordException("expected " + BALL_COUNT + " distinct balls for period "
                    + period + ", got " + balls.size() + " (" + sorted.size() + " distinct)");
        }
        if (superNumber != null && !NumericTokens.isBall(superNumber)) {
            throw new InvalidDrawRecordException("super number out of range for period " + period + ": " + superNumber);
        }

        return new DrawRecord(period.trim(), date, Collections.unmodifiableList(new ArrayList<>(sorted)), superNumber);
    }

    /**
     * Complete = all 20 balls plus a super number.
     */
    public boolean isComplete() {
        return balls.size() == BALL_COUNT && superNumber != null;
    }
}
