package com.resource.naming.ledger;

import com.resource.naming.audit.AuditAction;
import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.ClaimedName;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.error.ConflictException;
import com.resource.naming.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryClaimLedgerTest {

    private InMemoryClaimLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryClaimLedger();
    }

    private static ClaimedName claim(String name, String actor) {
        return ClaimedName.builder()
                .name(name)
                .region("wus2")
                .environment("prod")
                .resourceType("storage_account")
                .slug("st")
                .claimedBy(actor)
                .claimedAt(Instant.parse("2024-03-01T12:00:00Z"))
                .metadata(Map.of("team", "platform"))
                .build();
    }

    @Nested
    @DisplayName("createIfAbsent")
    class Create {

        @Test
        void storesRowAndReturnsVersion() {
            ClaimedName record = claim("stwus2prod", "alice");
            VersionToken version = ledger.createIfAbsent(record.key(), record);

            VersionedClaim stored = ledger.get(ClaimKey.of("wus2", "prod", "stwus2prod"));
            assertEquals(version, stored.version());
            assertEquals("alice", stored.claim().claimedBy());
            assertTrue(stored.claim().inUse());
            assertEquals(1, ledger.size());
        }

        @Test
        void existingRowConflicts() {
            ClaimedName record = claim("stwus2prod", "alice");
            ledger.createIfAbsent(record.key(), record);

            ConflictException ex = assertThrows(ConflictException.class,
                    () -> ledger.createIfAbsent(record.key(), claim("stwus2prod", "bob")));
            assertTrue(ex.getMessage().contains("already exists in wus2-prod"));
            assertEquals("alice", ledger.get(record.key()).claim().claimedBy());
        }

        @Test
        void keysAreCaseInsensitive() {
            ClaimedName record = claim("stwus2prod", "alice");
            ledger.createIfAbsent(ClaimKey.of("WUS2", "Prod", "STWUS2PROD"), record);

            assertThrows(ConflictException.class,
                    () -> ledger.createIfAbsent(ClaimKey.of("wus2", "prod", "stwus2prod"), record));
        }

        @Test
        void sameNameInAnotherPartitionIsIndependent() {
            ClaimedName record = claim("stshared", "alice");
            ledger.createIfAbsent(ClaimKey.of("wus2", "prod", "stshared"), record);
            ledger.createIfAbsent(ClaimKey.of("eus", "prod", "stshared"), record);

            assertEquals(2, ledger.size());
        }

        @Test
        @DisplayName("concurrent creates of one key: exactly one wins")
        void concurrentCreatesHaveSingleWinner() throws Exception {
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger wins = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    String actor = "actor" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        ClaimedName record = claim("vmraceprod", actor);
                        try {
                            ledger.createIfAbsent(record.key(), record);
                            wins.incrementAndGet();
                        } catch (ConflictException e) {
                            conflicts.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, wins.get());
            assertEquals(threads - 1, conflicts.get());
            assertEquals(1, ledger.size());
        }
    }

    @Nested
    @DisplayName("replaceIfUnchanged")
    class Replace {

        @Test
        void matchingVersionReplacesAndBumpsVersion() {
            ClaimedName record = claim("stwus2prod", "alice");
            VersionToken v1 = ledger.createIfAbsent(record.key(), record);

            ClaimedName released = record.release("alice", Instant.parse("2024-03-02T00:00:00Z"), "decommissioned");
            VersionToken v2 = ledger.replaceIfUnchanged(record.key(), released, v1);

            assertNotEquals(v1, v2);
            VersionedClaim stored = ledger.get(record.key());
            assertFalse(stored.claim().inUse());
            assertEquals("decommissioned", stored.claim().releaseReason());
            assertEquals(v2, stored.version());
        }

        @Test
        void staleVersionConflictsAndLeavesRowUntouched() {
            ClaimedName record = claim("stwus2prod", "alice");
            VersionToken v1 = ledger.createIfAbsent(record.key(), record);
            VersionToken v2 = ledger.replaceIfUnchanged(record.key(),
                    record.release("alice", Instant.now(), "first"), v1);

            assertThrows(ConflictException.class, () -> ledger.replaceIfUnchanged(record.key(),
                    record.release("bob", Instant.now(), "second"), v1));

            VersionedClaim stored = ledger.get(record.key());
            assertEquals(v2, stored.version());
            assertEquals("first", stored.claim().releaseReason());
        }

        @Test
        void missingRowIsNotFound() {
            ClaimedName record = claim("ghost", "alice");
            assertThrows(NotFoundException.class,
                    () -> ledger.replaceIfUnchanged(record.key(), record, VersionToken.of(1)));
            assertEquals(0, ledger.size());
        }
    }

    @Test
    void getMissingRowIsNotFound() {
        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> ledger.get(ClaimKey.of("wus2", "prod", "nothing")));
        assertTrue(ex.getMessage().contains("nothing"));
    }

    @Test
    void auditIsDelegatedToRepository() {
        AuditEntry entry = AuditEntry.builder()
                .action(AuditAction.CLAIMED)
                .name("stwus2prod")
                .actor("alice")
                .region("wus2")
                .environment("prod")
                .build();
        ledger.appendAudit(entry);

        assertEquals(List.of(entry), ledger.auditTrail(ClaimKey.of("wus2", "prod", "stwus2prod")));
        assertEquals(List.of(entry), ledger.queryAudit(AuditQuery.all().withActor("alice")));
        assertTrue(ledger.queryAudit(AuditQuery.all().withActor("bob")).isEmpty());
    }
}
