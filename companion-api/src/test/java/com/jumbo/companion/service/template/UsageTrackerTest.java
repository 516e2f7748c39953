package com.jumbo.companion.service.template;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UsageTrackerTest {

    private final UsageTracker tracker = new UsageTracker(100, 60);

    @Test
    void unknownUserHasEmptySnapshot() {
        UsageTracker.Snapshot snapshot = tracker.snapshot("nobody");

        assertThat(snapshot.turnIndex()).isZero();
        assertThat(snapshot.history()).isEmpty();
        assertThat(snapshot.rotationWindow(3)).isEmpty();
    }

    @Test
    void historyIsBoundedAndWindowHoldsLatestIds() {
        for (int i = 0; i < UsageTracker.HISTORY_SIZE + 5; i++) {
            tracker.recordTemplate("u1", "t" + i, false);
        }

        UsageTracker.Snapshot snapshot = tracker.snapshot("u1");
        assertThat(snapshot.history()).hasSize(UsageTracker.HISTORY_SIZE);
        assertThat(snapshot.rotationWindow(3)).containsExactly("t12", "t13", "t14");
        assertThat(snapshot.turnIndex()).isEqualTo(15);
    }

    @Test
    void followUpCursorAdvancesOnlyWhenQuestionUsed() {
        tracker.recordTemplate("u1", "t1", true);
        tracker.recordTemplate("u1", "t1", false);
        tracker.recordTemplate("u1", "t1", true);

        UsageTracker.Snapshot snapshot = tracker.snapshot("u1");
        assertThat(snapshot.followUpCursor("t1")).isEqualTo(2);
        assertThat(snapshot.recentUses("t1")).isEqualTo(3);
    }

    @Test
    void nonTemplateTurnsOnlyAdvanceTheTurnIndex() {
        tracker.recordTurn("u1");

        assertThat(tracker.snapshot("u1").turnIndex()).isEqualTo(1);
        assertThat(tracker.snapshot("u1").history()).isEmpty();
        assertThat(tracker.trackedUsers()).isEqualTo(1);
    }

    @Test
    void snapshotIsDetachedFromLaterUpdates() {
        tracker.recordTemplate("u1", "t1", false);
        UsageTracker.Snapshot before = tracker.snapshot("u1");

        tracker.recordTemplate("u1", "t2", false);

        assertThat(before.history()).containsExactly("t1");
    }
}
