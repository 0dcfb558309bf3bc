package com.sibol.contract_ledger.ledger;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per contract id. Writes to the same contract run one at a time inside this JVM;
 * writes to different contracts do not contend.
 *
 * An entry lives only while some thread holds or waits for it. The user count is changed
 * only inside {@code compute}, so an entry is never removed between another thread looking
 * it up and locking it.
 */
class ContractLocks {

    private final Map<UUID, Entry> locks = new ConcurrentHashMap<>();

    <T> T withLock(UUID contractId, Supplier<T> action) {
        Entry entry = locks.compute(contractId, (id, current) -> {
            Entry acquired = current != null ? current : new Entry();
            acquired.users++;
            return acquired;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(contractId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute
        private int users;
    }
}
