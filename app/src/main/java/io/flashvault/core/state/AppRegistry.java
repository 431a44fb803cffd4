package io.flashvault.core.state;

import io.flashvault.core.protocol.Address;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/** Apps allowed to report balance deltas. Registration is permanent. */
public final class AppRegistry {

    private final LedgerJournal journal;
    private final Set<Address> apps = new HashSet<>();

    public AppRegistry(LedgerJournal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
    }

    /** @return true if the app was not registered before */
    public boolean register(Address app) {
        Objects.requireNonNull(app, "app");
        boolean added = apps.add(app);
        if (added) {
            journal.record(() -> apps.remove(app));
        }
        return added;
    }

    public boolean isRegistered(Address app) {
        return app != null && apps.contains(app);
    }

    public Set<Address> entries() {
        return Set.copyOf(apps);
    }

    public void restore(Set<Address> committed) {
        apps.clear();
        apps.addAll(committed);
    }
}
