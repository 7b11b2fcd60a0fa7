package tech.yump.rotation.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class StaggerPlannerTest {

    private final StaggerPlanner planner = new StaggerPlanner(new Random(7));

    @Test
    @DisplayName("Every offset lies within the window and each slot is used once")
    void offsetsAreStratified() {
        Duration window = Duration.ofMinutes(10);
        int count = 20;

        List<Duration> offsets = planner.plan(count, window);

        assertThat(offsets).hasSize(count);
        long slotMillis = window.toMillis() / count;
        boolean[] used = new boolean[count];
        for (Duration offset : offsets) {
            assertThat(offset).isGreaterThanOrEqualTo(Duration.ZERO).isLessThan(window);
            int slot = (int) Math.min(count - 1, offset.toMillis() / slotMillis);
            assertThat(used[slot]).as("slot %d used twice", slot).isFalse();
            used[slot] = true;
        }
    }

    @Test
    @DisplayName("Zero window puts everything at offset zero")
    void zeroWindow() {
        assertThat(planner.plan(3, Duration.ZERO)).containsExactly(Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    @Test
    @DisplayName("No due classes yields no offsets")
    void emptyPlan() {
        assertThat(planner.plan(0, Duration.ofMinutes(5))).isEmpty();
    }
}
