package com.storesync.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilienceTrackerTest {

    private final ResilienceTracker tracker = new ResilienceTracker();

    @Test
    void recordsAreAttributedToActiveStage() {
        tracker.startStageContext("Managing channels");
        tracker.recordRateLimit();
        tracker.recordRateLimit();
        tracker.recordRetry();
        tracker.recordNetworkError();
        tracker.recordGraphQLError();

        StageMetrics metrics = tracker.endStageContext().orElseThrow();

        assertThat(metrics).isEqualTo(new StageMetrics(2, 1, 1, 1));
        assertThat(tracker.getStageMetrics("Managing channels")).contains(metrics);
        assertThat(tracker.isInStageContext()).isFalse();
    }

    @Test
    void recordsWithoutStage_areIgnored() {
        tracker.recordRateLimit();
        tracker.recordRetry();

        assertThat(tracker.endStageContext()).isEmpty();
        assertThat(tracker.getAllStageMetrics()).isEmpty();
    }

    @Test
    void nestedStart_isRejected() {
        tracker.startStageContext("Managing channels");

        assertThatThrownBy(() -> tracker.startStageContext("Managing warehouses"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Managing channels");
        assertThat(tracker.getCurrentStageName()).contains("Managing channels");
    }

    @Test
    void stagesAreKeptInCompletionOrder_andCountersStartFresh() {
        tracker.startStageContext("Managing channels");
        tracker.recordRetry();
        tracker.endStageContext();
        tracker.startStageContext("Managing warehouses");
        tracker.endStageContext();

        assertThat(tracker.getAllStageMetrics()).containsOnlyKeys("Managing channels", "Managing warehouses");
        assertThat(tracker.getAllStageMetrics().keySet()).containsExactly("Managing channels", "Managing warehouses");
        assertThat(tracker.getStageMetrics("Managing warehouses")).contains(StageMetrics.EMPTY);
    }

    @Test
    void reset_dropsStoredMetricsAndActiveStage() {
        tracker.startStageContext("Managing channels");
        tracker.endStageContext();
        tracker.startStageContext("Managing products");

        tracker.reset();

        assertThat(tracker.getAllStageMetrics()).isEmpty();
        assertThat(tracker.isInStageContext()).isFalse();
    }
}
