package tech.yump.rotation.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Spreads simultaneously due classes over the stagger window: the window is split into one slot
 * per class, slots are shuffled, and each class draws a uniform offset inside its own slot.
 */
public class StaggerPlanner {

    private final Random random;

    public StaggerPlanner(Random random) {
        this.random = random;
    }

    /**
     * @return {@code count} offsets in {@code [0, window)}, one per due class in input order.
     */
    public List<Duration> plan(int count, Duration window) {
        if (count <= 0) {
            return List.of();
        }
        long windowMillis = window.toMillis();
        if (windowMillis <= 0) {
            return Collections.nCopies(count, Duration.ZERO);
        }
        List<Integer> slots = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            slots.add(i);
        }
        Collections.shuffle(slots, random);

        double slotMillis = (double) windowMillis / count;
        List<Duration> offsets = new ArrayList<>(count);
        for (int slot : slots) {
            long offset = (long) (slot * slotMillis + random.nextDouble() * slotMillis);
            offsets.add(Duration.ofMillis(Math.min(offset, windowMillis - 1)));
        }
        return offsets;
    }
}
