package io.flashvault.core.state;

import java.util.ArrayList;
import java.util.List;

/**
 * Undo log shared by the ledgers of one vault.
 * Every write records its inverse; {@link #revertTo(int)} replays inverses newest first.
 * Not thread-safe; the owning vault serializes access.
 */
public final class LedgerJournal {

    private final List<Runnable> undo = new ArrayList<>();

    /** Position to roll back to. */
    public int checkpoint() {
        return undo.size();
    }

    public void record(Runnable undoAction) {
        undo.add(undoAction);
    }

    public void revertTo(int checkpoint) {
        if (checkpoint < 0 || checkpoint > undo.size()) {
            throw new IllegalArgumentException("Unknown checkpoint " + checkpoint);
        }
        for (int i = undo.size() - 1; i >= checkpoint; i--) {
            undo.remove(i).run();
        }
    }

    /** Forget all recorded writes; they can no longer be reverted. */
    public void commit() {
        undo.clear();
    }

    public int size() {
        return undo.size();
    }
}
