package com.sibol.contract_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ContractLocksTest {

    @Test
    @DisplayName("Finished contracts leave no lock behind")
    void testLocksReleasedAfterUse() {
        ContractLocks locks = new ContractLocks();

        for (int i = 0; i < 1000; i++) {
            locks.withLock(UUID.randomUUID(), () -> "done");
        }

        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("A failing action still releases its lock")
    void testLockReleasedOnFailure() {
        ContractLocks locks = new ContractLocks();

        assertThrows(IllegalStateException.class, () -> locks.withLock(UUID.randomUUID(), () -> {
            throw new IllegalStateException("rejected");
        }));

        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("Re-entering the same contract's lock keeps one entry and releases it at the end")
    void testReentrant() {
        ContractLocks locks = new ContractLocks();
        UUID contractId = UUID.randomUUID();

        int sizeInside = locks.withLock(contractId, () -> locks.withLock(contractId, locks::size));

        assertEquals(1, sizeInside);
        assertEquals(0, locks.size());
    }

    @Test
    @DisplayName("Threads on one contract never overlap, and the entry is gone afterwards")
    void testMutualExclusionUnderContention() throws InterruptedException {
        ContractLocks locks = new ContractLocks();
        UUID contractId = UUID.randomUUID();
        AtomicInteger inside = new AtomicInteger(0);
        AtomicInteger maxInside = new AtomicInteger(0);
        AtomicInteger completed = new AtomicInteger(0);

        int threadCount = 8;
        int rounds = 200;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < rounds; i++) {
                        locks.withLock(contractId, () -> {
                            int now = inside.incrementAndGet();
                            maxInside.accumulateAndGet(now, Math::max);
                            inside.decrementAndGet();
                            return completed.incrementAndGet();
                        });
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, maxInside.get());
        assertEquals(threadCount * rounds, completed.get());
        assertEquals(0, locks.size());
    }
}
