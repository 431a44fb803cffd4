package io.flashvault.core.storage;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.state.LedgerKey;
import org.rocksdb.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Persistent VaultStore using RocksDB.
 *
 * Layout (column families):
 *  - "apps"           : key = app address,              val = 0x01
 *  - "app_reserves"   : key = "app|currencyId",         val = reserve (unsigned big-endian)
 *  - "vault_reserves" : key = currencyId,               val = reserve (unsigned big-endian)
 *  - "meta"           : key = "committed",              val = 0x01 once anything was saved
 *
 * Zero balances are deleted rather than stored. A save writes only the keys that changed
 * since the previous commit; the database is read once, when the store opens.
 */
public final class RocksDBVaultStore implements VaultStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBVaultStore.class.getName());
    private static final byte[] PRESENT = {1};
    private static final byte[] COMMITTED_KEY = "committed".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfApps;
    private final ColumnFamilyHandle cfAppReserves;
    private final ColumnFamilyHandle cfVaultReserves;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> allHandles;
    private final DBOptions dbOptions;

    // encoded image of the last committed snapshot, diffed against on save
    private Map<String, byte[]> savedApps = Map.of();
    private Map<String, byte[]> savedAppReserves = Map.of();
    private Map<String, byte[]> savedVaultReserves = Map.of();
    private boolean committed;
    private int lastWriteCount;

    private RocksDBVaultStore(RocksDB db,
                              List<ColumnFamilyHandle> handles,
                              DBOptions dbOptions) {
        this.db = db;
        this.allHandles = handles;
        this.cfApps = handles.get(1);
        this.cfAppReserves = handles.get(2);
        this.cfVaultReserves = handles.get(3);
        this.cfMeta = handles.get(4);
        this.dbOptions = dbOptions;
        readSnapshot().ifPresent(existing -> {
            committed = true;
            savedApps = encodeApps(existing);
            savedAppReserves = encodeAppReserves(existing);
            savedVaultReserves = encodeVaultReserves(existing);
        });
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBVaultStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("apps".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("app_reserves".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("vault_reserves".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info("Opened vault store at " + dataDir);
            return new RocksDBVaultStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<VaultSnapshot> load() {
        return readSnapshot();
    }

    private Optional<VaultSnapshot> readSnapshot() {
        try {
            if (db.get(cfMeta, COMMITTED_KEY) == null) {
                return Optional.empty();
            }
        } catch (RocksDBException e) {
            throw new RuntimeException("load failed", e);
        }

        Set<Address> apps = new HashSet<>();
        for (String app : readAll(cfApps).keySet()) {
            apps.add(Address.of(app));
        }

        Map<LedgerKey, BigInteger> appReserves = new HashMap<>();
        for (Map.Entry<String, byte[]> e : readAll(cfAppReserves).entrySet()) {
            appReserves.put(parseReserveKey(e.getKey()), decode(e.getValue()));
        }

        Map<String, BigInteger> vaultReserves = new HashMap<>();
        for (Map.Entry<String, byte[]> e : readAll(cfVaultReserves).entrySet()) {
            vaultReserves.put(e.getKey(), decode(e.getValue()));
        }
        return Optional.of(new VaultSnapshot(apps, appReserves, vaultReserves));
    }

    @Override
    public synchronized void save(VaultSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot required");
        }
        Map<String, byte[]> apps = encodeApps(snapshot);
        Map<String, byte[]> appReserves = encodeAppReserves(snapshot);
        Map<String, byte[]> vaultReserves = encodeVaultReserves(snapshot);

        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            // only keys that differ from the last committed snapshot are written
            int writes = applyChanges(batch, cfApps, savedApps, apps)
                    + applyChanges(batch, cfAppReserves, savedAppReserves, appReserves)
                    + applyChanges(batch, cfVaultReserves, savedVaultReserves, vaultReserves);
            if (!committed) {
                batch.put(cfMeta, COMMITTED_KEY, PRESENT);
            }
            db.write(wo, batch);
            committed = true;
            savedApps = apps;
            savedAppReserves = appReserves;
            savedVaultReserves = vaultReserves;
            lastWriteCount = writes;
        } catch (RocksDBException e) {
            throw new RuntimeException("save failed", e);
        }
    }

    /** Keys put or deleted by the last {@link #save}. */
    synchronized int lastWriteCount() {
        return lastWriteCount;
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : allHandles) {
            handle.close();
        }
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static int applyChanges(WriteBatch batch, ColumnFamilyHandle cf,
                                    Map<String, byte[]> before, Map<String, byte[]> after) throws RocksDBException {
        int writes = 0;
        for (String existing : before.keySet()) {
            if (!after.containsKey(existing)) {
                batch.delete(cf, existing.getBytes(StandardCharsets.UTF_8));
                writes++;
            }
        }
        for (Map.Entry<String, byte[]> e : after.entrySet()) {
            if (!Arrays.equals(before.get(e.getKey()), e.getValue())) {
                batch.put(cf, e.getKey().getBytes(StandardCharsets.UTF_8), e.getValue());
                writes++;
            }
        }
        return writes;
    }

    private static Map<String, byte[]> encodeApps(VaultSnapshot snapshot) {
        Map<String, byte[]> out = new HashMap<>();
        for (Address app : snapshot.apps()) {
            out.put(app.value(), PRESENT);
        }
        return out;
    }

    private static Map<String, byte[]> encodeAppReserves(VaultSnapshot snapshot) {
        Map<String, byte[]> out = new HashMap<>();
        snapshot.appReserves().forEach((k, v) -> {
            if (v.signum() > 0) {
                out.put(reserveKey(k), encode(v));
            }
        });
        return out;
    }

    private static Map<String, byte[]> encodeVaultReserves(VaultSnapshot snapshot) {
        Map<String, byte[]> out = new HashMap<>();
        snapshot.vaultReserves().forEach((k, v) -> {
            if (v.signum() > 0) {
                out.put(k, encode(v));
            }
        });
        return out;
    }

    private Map<String, byte[]> readAll(ColumnFamilyHandle cf) {
        Map<String, byte[]> out = new LinkedHashMap<>();
        try (RocksIterator it = db.newIterator(cf)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.put(new String(it.key(), StandardCharsets.UTF_8), it.value());
            }
        }
        return out;
    }

    static String reserveKey(LedgerKey key) {
        return key.owner().value() + '|' + key.currencyId();
    }

    static LedgerKey parseReserveKey(String raw) {
        int sep = raw.indexOf('|');
        if (sep <= 0) {
            throw new IllegalStateException("Corrupt app reserve key: " + raw);
        }
        return new LedgerKey(Address.of(raw.substring(0, sep)), raw.substring(sep + 1));
    }

    private static byte[] encode(BigInteger value) {
        byte[] raw = value.toByteArray();
        if (raw.length > 1 && raw[0] == 0) {
            return Arrays.copyOfRange(raw, 1, raw.length);
        }
        return raw;
    }

    private static BigInteger decode(byte[] data) {
        if (data == null || data.length == 0) {
            return BigInteger.ZERO;
        }
        return new BigInteger(1, data);
    }
}
