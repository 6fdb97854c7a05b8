package com.ryuqq.fsm.testkit.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered log of lifecycle hook calls shared by several {@link RecordingState}s.
 *
 * <p>Entries are formatted as {@code "<state>.<hook>"}, for example
 * {@code "walk.onExit"} or {@code "jump.onEnter(payload)"}.</p>
 *
 * @author FSM Team
 * @since 1.0.0
 */
public final class HookJournal {

    private final List<String> entries = new ArrayList<>();

    /**
     * Appends an entry.
     *
     * @param entry the entry to record
     */
    public void record(String entry) {
        entries.add(entry);
    }

    /**
     * Returns the recorded entries in call order.
     *
     * @return unmodifiable snapshot of the entries
     */
    public List<String> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Counts how many times an entry was recorded.
     *
     * @param entry the entry to count
     * @return number of occurrences
     */
    public int count(String entry) {
        return Collections.frequency(entries, entry);
    }

    /**
     * Removes every recorded entry.
     */
    public void clear() {
        entries.clear();
    }
}
