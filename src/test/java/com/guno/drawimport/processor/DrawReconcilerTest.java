package com.guno.drawimport.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.drawimport.dto.internal.MergeResult;
import com.guno.drawimport.entity.DrawRecord;
import com.guno.drawimport.entity.DrawStore;
import com.guno.drawimport.repository.DrawStoreCodec;
import com.guno.drawimport.test.util.DrawFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DrawReconcilerTest {

    private final DrawReconciler reconciler = new DrawReconciler(new DrawStoreCodec(new ObjectMapper()));

    @Test
    void shouldInsertAbsentPeriodsInAscendingOrder() {
        MergeResult result = reconciler.reconcile(DrawStore.empty(), List.of(
                DrawFixtures.complete("114046630", 1, 50),
                DrawFixtures.complete("114046629", 2, 50)));

        assertThat(result.isChanged()).isTrue();
        assertThat(result.getAdded()).isEqualTo(2);
        assertThat(result.getStore().toList()).extracting(DrawRecord::getPeriod)
                .containsExactly("114046629", "114046630");
    }

    @Test
    void shouldNeverDowngradeCompleteRecord() {
        DrawStore existing = DrawStore.of(List.of(DrawFixtures.complete("X", 1, 44)));

        MergeResult result = reconciler.reconcile(existing, List.of(DrawFixtures.incomplete("X", 1)));

        assertThat(result.isChanged()).isFalse();
        assertThat(result.getIgnored()).isEqualTo(1);
        assertThat(result.getStore().get("X")).hasValueSatisfying(r -> assertThat(r.getSuperNumber()).isEqualTo(44));
    }

    @Test
    void shouldUpgradeIncompleteRecord() {
        DrawStore existing = DrawStore.of(List.of(DrawFixtures.incomplete("X", 1)));

        MergeResult result = reconciler.reconcile(existing, List.of(DrawFixtures.complete("X", 1, 44)));

        assertThat(result.isChanged()).isTrue();
        assertThat(result.getUpgraded()).isEqualTo(1);
        assertThat(result.getStore().get("X").orElseThrow().isComplete()).isTrue();
    }

    @Test
    void shouldKeepFirstCompleteRecordOnConflict() {
        DrawStore existing = DrawStore.of(List.of(DrawFixtures.complete("X", 1, 44)));

        MergeResult result = reconciler.reconcile(existing, List.of(DrawFixtures.complete("X", 5, 45)));

        assertThat(result.isChanged()).isFalse();
        assertThat(result.getConflicts()).isEqualTo(1);
        assertThat(result.getStore()).isEqualTo(existing);
    }

    @Test
    void shouldBeIdempotent() {
        List<DrawRecord> batch = List.of(
                DrawFixtures.complete("114046629", 1, 60),
                DrawFixtures.incomplete("114046630", 2),
                DrawFixtures.complete("114046631", 3, 61));

        MergeResult once = reconciler.reconcile(DrawStore.empty(), batch);
        MergeResult twice = reconciler.reconcile(once.getStore(), batch);

        assertThat(twice.isChanged()).isFalse();
        assertThat(twice.getStore()).isEqualTo(once.getStore());
    }

    @Test
    void shouldReportUnchangedForSubsetOfStore() {
        DrawStore existing = DrawStore.of(List.of(
                DrawFixtures.complete("1", 1, 60),
                DrawFixtures.complete("2", 2, 60),
                DrawFixtures.complete("3", 3, 60)));

        MergeResult result = reconciler.reconcile(existing, List.of(DrawFixtures.complete("2", 2, 60)));

        assertThat(result.isChanged()).isFalse();
        assertThat(result.getAdded()).isZero();
    }
}
