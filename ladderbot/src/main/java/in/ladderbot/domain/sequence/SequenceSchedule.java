package in.ladderbot.domain.sequence;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Entry timestamp plus one {@link ScheduleEntry} per level, in level order.
 *
 * Level 1 is submitted at {@link #entryAt()}; level k (k > 1) is submitted at
 * level k-1's dueAt, which is that level's expiry.
 */
public record SequenceSchedule(
    ZoneId zone,
    Instant entryAt,
    List<ScheduleEntry> entries
) {
    public SequenceSchedule {
        if (zone == null) {
            throw new IllegalArgumentException("Zone cannot be null");
        }
        if (entryAt == null) {
            throw new IllegalArgumentException("Entry time cannot be null");
        }
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Schedule must contain at least one level");
        }
        entries = List.copyOf(entries);
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).sequenceLevel() != i + 1) {
                throw new IllegalArgumentException(
                    "Entries must be in level order, found level " + entries.get(i).sequenceLevel()
                        + " at position " + (i + 1));
            }
        }
    }

    public int levelCount() {
        return entries.size();
    }

    /**
     * Get the entry for a 1-indexed level.
     */
    public ScheduleEntry level(int level) {
        if (level < 1 || level > entries.size()) {
            throw new IndexOutOfBoundsException("Level " + level + " outside 1.." + entries.size());
        }
        return entries.get(level - 1);
    }

    /**
     * Moment at which the action for a level is due to be submitted.
     */
    public Instant submissionDueAt(int level) {
        return level == 1 ? entryAt : level(level - 1).dueAt();
    }
}
