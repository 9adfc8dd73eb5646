package com.guno.drawimport.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BallSequenceTest {

    private static List<String> runs(int from, int to) {
        List<String> out = new ArrayList<>();
        for (int i = from; i <= to; i++) out.add(String.format("%02d", i));
        return out;
    }

    @Test
    void shouldKeepFirstDistinctInRangeBallsInSourceOrder() {
        List<String> runs = new ArrayList<>(List.of("05", "5", "99", "2025"));
        runs.addAll(runs(6, 24));

        BallSequence sequence = BallSequence.of(runs);

        assertThat(sequence.isFull()).isTrue();
        assertThat(sequence.getBalls()).startsWith(5, 6).endsWith(24).doesNotContain(99);
        assertThat(sequence.getTrailing()).isNull();
    }

    @Test
    void shouldKeepTrailingTokenThatRepeatsABall() {
        List<String> runs = runs(1, 20);
        runs.add("05");
        runs.add("77");

        BallSequence sequence = BallSequence.of(runs);

        assertThat(sequence.getBalls()).hasSize(20);
        assertThat(sequence.getTrailing()).isEqualTo(5);
        assertThat(sequence.toTokenString()).endsWith("19 20 5");
    }

    @Test
    void shouldReportShortSequences() {
        BallSequence sequence = BallSequence.of(List.of("1", "2", "2", "81"));

        assertThat(sequence.isFull()).isFalse();
        assertThat(sequence.getBalls()).containsExactly(1, 2);
        assertThat(BallSequence.empty().getBalls()).isEmpty();
    }
}
