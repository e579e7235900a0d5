package com.resource.naming.api;

import com.resource.naming.audit.AuditAction;
import com.resource.naming.audit.AuditEntry;
import com.resource.naming.audit.AuditQuery;
import com.resource.naming.audit.AuditRepository;
import com.resource.naming.core.model.ClaimKey;
import com.resource.naming.core.model.VersionToken;
import com.resource.naming.core.model.VersionedClaim;
import com.resource.naming.ledger.InMemoryClaimLedger;
import com.resource.naming.metrics.MicrometerNamingMetrics;
import com.resource.naming.rules.RuleDescription;
import com.resource.naming.security.AuthContext;
import com.resource.naming.security.SecurityRole;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("NameClaimService")
class NameClaimServiceTest {

    private static final AuthContext ALICE = AuthContext.of("alice", SecurityRole.CONTRIBUTOR);
    private static final AuthContext BOB = AuthContext.of("bob", SecurityRole.CONTRIBUTOR);
    private static final AuthContext ADMIN = AuthContext.of("root", SecurityRole.ADMIN);
    private static final AuthContext READER = AuthContext.of("carol", SecurityRole.READER);

    private InMemoryClaimLedger ledger;
    private NamingEngine engine;
    private NameClaimService service;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryClaimLedger();
        engine = NamingEngine.builder().ledger(ledger).build();
        service = engine.service();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static ClaimRequest storageAccount() {
        return ClaimRequest.builder()
                .resourceType("storage_account")
                .region("wus2")
                .environment("prod")
                .metadata("team", "platform")
                .build();
    }

    @Nested
    @DisplayName("claim")
    class Claim {

        @Test
        @DisplayName("builds, reserves and audits a compliant name")
        void claimsStorageAccount() {
            ClaimResult result = service.claim(storageAccount(), ALICE);

            assertTrue(result.isClaimed(), result.message());
            assertEquals("org-st-wus2-prod", result.name());
            assertEquals("st", result.slug());
            assertEquals("alice", result.claimedBy());
            assertEquals(Map.of("team", "platform"), result.metadata());
            assertNotNull(result.version());
            assertTrue(result.warnings().isEmpty());

            VersionedClaim stored = ledger.get(ClaimKey.of("wus2", "prod", "org-st-wus2-prod"));
            assertTrue(stored.claim().inUse());
            assertEquals(result.version(), stored.version());

            List<AuditEntry> trail = ledger.auditTrail(stored.claim().key());
            assertEquals(1, trail.size());
            assertEquals(AuditAction.CLAIMED, trail.get(0).action());
            assertEquals("storage_account", trail.get(0).metadata().get("resourceType"));
        }

        @Test
        @DisplayName("a live name is not claimed twice")
        void secondClaimConflicts() {
            assertTrue(service.claim(storageAccount(), ALICE).isClaimed());

            ClaimResult second = service.claim(storageAccount(), BOB);

            assertEquals(ResultStatus.CONFLICT, second.status());
            assertEquals("Name 'org-st-wus2-prod' is already in use.", second.message());
            assertEquals("alice", ledger.get(ClaimKey.of("wus2", "prod", "org-st-wus2-prod")).claim().claimedBy());
        }

        @Test
        @DisplayName("concurrent claims of one name: exactly one succeeds")
        void concurrentClaims() throws Exception {
            int threads = 12;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ClaimResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    AuthContext caller = AuthContext.of("user" + i, SecurityRole.CONTRIBUTOR);
                    futures.add(executor.submit(() -> {
                        start.await();
                        return service.claim(storageAccount(), caller);
                    }));
                }
                start.countDown();
                int claimed = 0;
                int conflicts = 0;
                for (Future<ClaimResult> future : futures) {
                    ClaimResult result = future.get(10, TimeUnit.SECONDS);
                    if (result.isClaimed()) {
                        claimed++;
                    } else if (result.status() == ResultStatus.CONFLICT) {
                        conflicts++;
                    }
                }
                assertEquals(1, claimed);
                assertEquals(threads - 1, conflicts);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, ledger.size());
        }

        @Test
        @DisplayName("a released name can be claimed again")
        void reclaimAfterRelease() {
            ClaimResult first = service.claim(storageAccount(), ALICE);
            assertTrue(service.release(
                    ReleaseRequest.of("wus2", "prod", first.name(), first.version()), ALICE).isReleased());

            ClaimResult again = service.claim(storageAccount(), BOB);

            assertTrue(again.isClaimed(), again.message());
            assertEquals(first.name(), again.name());
            VersionedClaim stored = ledger.get(ClaimKey.of("wus2", "prod", first.name()));
            assertEquals("bob", stored.claim().claimedBy());
            assertTrue(stored.claim().inUse());
            assertNull(stored.claim().releasedBy());
        }

        @Test
        @DisplayName("an optional index segment is appended on conflict")
        void indexRetryForOptionalIndex() {
            ClaimRequest vm = ClaimRequest.builder()
                    .resourceType("virtual_machine").region("wus2").environment("prod").build();

            assertEquals("vm-prod-wus2", service.claim(vm, ALICE).name());
            assertEquals("vm-prod-wus2-01", service.claim(vm, ALICE).name());
            assertEquals("vm-prod-wus2-02", service.claim(vm, ALICE).name());
        }

        @Test
        @DisplayName("a required index starts at 01 and stops after the attempt limit")
        void indexRetryForRequiredIndex() {
            ClaimRequest aks = ClaimRequest.builder()
                    .resourceType("kubernetes_cluster").region("wus2").environment("prod")
                    .segment("system", "erp").build();

            for (int i = 1; i <= NamingOptions.DEFAULT_MAX_CLAIM_ATTEMPTS; i++) {
                ClaimResult result = service.claim(aks, ALICE);
                assertEquals(String.format("aks-erp-prod-wus2-%02d", i), result.name());
            }
            ClaimResult exhausted = service.claim(aks, ALICE);
            assertEquals(ResultStatus.CONFLICT, exhausted.status());
            assertTrue(exhausted.message().startsWith("All 5 candidate names"));
        }

        @Test
        @DisplayName("an explicit index is never changed")
        void explicitIndexIsSingleAttempt() {
            ClaimRequest vm = ClaimRequest.builder()
                    .resourceType("virtual_machine").region("wus2").environment("prod")
                    .segment("index", "07").build();

            assertEquals("vm-prod-wus2-07", service.claim(vm, ALICE).name());
            assertEquals(ResultStatus.CONFLICT, service.claim(vm, ALICE).status());
        }

        @Test
        void missingRegionIsInvalid() {
            ClaimResult result = service.claim(ClaimRequest.builder()
                    .resourceType("storage_account").environment("prod").build(), ALICE);

            assertEquals(ResultStatus.INVALID, result.status());
            assertTrue(result.message().contains("region"));
            assertEquals(0, ledger.size());
        }

        @Test
        void malformedEnvironmentIsInvalid() {
            ClaimResult result = service.claim(ClaimRequest.builder()
                    .resourceType("storage_account").region("wus2").environment("prod'; --").build(), ALICE);
            assertEquals(ResultStatus.INVALID, result.status());
        }

        @Test
        void unsupportedSegmentIsInvalid() {
            ClaimResult result = service.claim(ClaimRequest.builder()
                    .resourceType("storage_account").region("wus2").environment("prod")
                    .segment("owner", "x").build(), ALICE);
            assertEquals(ResultStatus.INVALID, result.status());
            assertTrue(result.message().contains("owner"));
        }

        @Test
        void ruleValidatorsApply() {
            ClaimResult result = service.claim(ClaimRequest.builder()
                    .resourceType("app_service").region("wus2").environment("prod").build(), ALICE);
            assertEquals(ResultStatus.INVALID, result.status());
        }

        @Test
        void unknownSlugIsNotFound() {
            ClaimResult result = service.claim(ClaimRequest.builder()
                    .resourceType("quantum_computer").region("wus2").environment("prod").build(), ALICE);
            assertEquals(ResultStatus.NOT_FOUND, result.status());
        }

        @Test
        void readerCannotClaim() {
            ClaimResult result = service.claim(storageAccount(), READER);
            assertEquals(ResultStatus.FORBIDDEN, result.status());
            assertEquals(0, ledger.size());
        }

        @Test
        void missingAuthIsForbidden() {
            assertEquals(ResultStatus.FORBIDDEN, service.claim(storageAccount(), null).status());
        }

        @Test
        @DisplayName("stored defaults fill missing fields")
        void defaultsApply() {
            service.saveDefaults(null, Map.of("region", "eus", "environment", "dev"), ALICE);

            ClaimResult result = service.claim(ClaimRequest.builder().resourceType("storage_account").build(), ALICE);

            assertTrue(result.isClaimed(), result.message());
            assertEquals("org-st-eus-dev", result.name());
        }
    }

    @Nested
    @DisplayName("release")
    class Release {

        private ClaimResult claimed;

        @BeforeEach
        void claim() {
            claimed = service.claim(storageAccount(), ALICE);
        }

        @Test
        void claimantReleases() {
            ReleaseResult result = service.release(new ReleaseRequest("wus2", "prod", claimed.name(),
                    "decommissioned", claimed.version()), ALICE);

            assertTrue(result.isReleased(), result.message());
            assertFalse(result.claim().inUse());
            assertEquals("alice", result.claim().releasedBy());
            assertEquals("decommissioned", result.claim().releaseReason());
            assertNotEquals(claimed.version(), result.version());

            List<AuditEntry> trail = ledger.auditTrail(ClaimKey.of("wus2", "prod", claimed.name()));
            assertEquals(List.of(AuditAction.CLAIMED, AuditAction.RELEASED),
                    trail.stream().map(AuditEntry::action).toList());
            assertEquals("decommissioned", trail.get(1).note());
        }

        @Test
        void reasonDefaults() {
            ReleaseResult result = service.release(
                    ReleaseRequest.of("wus2", "prod", claimed.name(), claimed.version()), ALICE);
            assertEquals(NamingOptions.DEFAULT_RELEASE_REASON, result.claim().releaseReason());
        }

        @Test
        @DisplayName("a stale version conflicts and leaves the row unchanged")
        void staleVersionConflicts() {
            ClaimKey key = ClaimKey.of("wus2", "prod", claimed.name());
            VersionToken stale = claimed.version();
            assertTrue(service.release(ReleaseRequest.of("wus2", "prod", claimed.name(), stale), ALICE).isReleased());
            VersionedClaim before = ledger.get(key);

            ReleaseResult result = service.release(new ReleaseRequest("wus2", "prod", claimed.name(),
                    "again", stale), ALICE);

            assertEquals(ResultStatus.CONFLICT, result.status());
            VersionedClaim after = ledger.get(key);
            assertEquals(before.version(), after.version());
            assertEquals(before.claim(), after.claim());
        }

        @Test
        void otherContributorIsForbidden() {
            ReleaseResult result = service.release(
                    ReleaseRequest.of("wus2", "prod", claimed.name(), claimed.version()), BOB);

            assertEquals(ResultStatus.FORBIDDEN, result.status());
            assertTrue(ledger.get(ClaimKey.of("wus2", "prod", claimed.name())).claim().inUse());
        }

        @Test
        void adminMayReleaseAnyName() {
            assertTrue(service.release(
                    ReleaseRequest.of("wus2", "prod", claimed.name(), claimed.version()), ADMIN).isReleased());
        }

        @Test
        void previousReleaserMayReleaseAgain() {
            ReleaseResult first = service.release(
                    ReleaseRequest.of("wus2", "prod", claimed.name(), claimed.version()), ADMIN);
            ReleaseResult again = service.release(
                    ReleaseRequest.of("wus2", "prod", claimed.name(), first.version()),
                    AuthContext.of("ROOT", SecurityRole.CONTRIBUTOR));
            assertTrue(again.isReleased(), again.message());
        }

        @Test
        @DisplayName("a release without a version is rejected and leaves the claim in use")
        void missingVersionIsInvalid() {
            ReleaseResult result = service.release(
                    new ReleaseRequest("wus2", "prod", claimed.name(), null, null), ALICE);

            assertEquals(ResultStatus.INVALID, result.status());
            assertTrue(result.message().contains("expectedVersion"));
            assertTrue(ledger.get(ClaimKey.of("wus2", "prod", claimed.name())).claim().inUse());
        }

        @Test
        @DisplayName("a delayed duplicate release cannot free a newer claim")
        void delayedDuplicateReleaseConflicts() {
            ReleaseRequest release = ReleaseRequest.of("wus2", "prod", claimed.name(), claimed.version());
            assertTrue(service.release(release, ALICE).isReleased());
            ClaimResult reclaimed = service.claim(storageAccount(), ALICE);
            assertTrue(reclaimed.isClaimed(), reclaimed.message());

            ReleaseResult replayed = service.release(release, ALICE);

            assertEquals(ResultStatus.CONFLICT, replayed.status());
            VersionedClaim row = ledger.get(ClaimKey.of("wus2", "prod", claimed.name()));
            assertTrue(row.claim().inUse());
            assertEquals(reclaimed.version(), row.version());
        }

        @Test
        void unknownNameIsNotFound() {
            assertEquals(ResultStatus.NOT_FOUND,
                    service.release(ReleaseRequest.of("wus2", "prod", "nothing-here", VersionToken.of(1)), ALICE).status());
        }

        @Test
        void malformedNameIsInvalid() {
            assertEquals(ResultStatus.INVALID,
                    service.release(ReleaseRequest.of("wus2", "prod", "bad name!", VersionToken.of(1)), ALICE).status());
        }
    }

    @Nested
    @DisplayName("audit write failures")
    class AuditFailures {

        @Test
        @DisplayName("claim stays committed and carries a warning")
        void claimWarnsWhenAuditFails() {
            AuditRepository failing = mock(AuditRepository.class);
            when(failing.save(any())).thenThrow(new IllegalStateException("audit store down"));
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            InMemoryClaimLedger failingLedger = new InMemoryClaimLedger(failing);

            try (NamingEngine failingEngine = NamingEngine.builder()
                    .ledger(failingLedger)
                    .metrics(new MicrometerNamingMetrics(registry))
                    .build()) {
                ClaimResult result = failingEngine.service().claim(storageAccount(), ALICE);

                assertTrue(result.isClaimed());
                assertTrue(result.hasWarning(ResultWarning.AUDIT_WRITE_FAILED));
                assertEquals(1, failingLedger.size());

                ReleaseResult released = failingEngine.service()
                        .release(ReleaseRequest.of("wus2", "prod", result.name(), result.version()), ALICE);
                assertTrue(released.isReleased());
                assertTrue(released.hasWarning(ResultWarning.AUDIT_WRITE_FAILED));
            }
            assertEquals(2.0, registry.find("naming.audit.append.failed").counters().stream()
                    .mapToDouble(c -> c.count()).sum());
            verify(failing, times(2)).save(any());
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void getClaimReturnsRowAndVersion() {
            ClaimResult claimed = service.claim(storageAccount(), ALICE);

            OperationResult<VersionedClaim> read = service.getClaim("WUS2", "prod", claimed.name().toUpperCase(), READER);

            assertTrue(read.isSuccess());
            assertEquals(claimed.version(), read.value().version());
        }

        @Test
        void lookupSlug() {
            OperationResult<SlugLookup> lookup = service.lookupSlug("Storage Account", READER);
            assertTrue(lookup.isSuccess());
            assertEquals("st", lookup.value().slug());
            assertEquals("storage_account", lookup.value().resourceType());
        }

        @Test
        void describeAndListRules() {
            OperationResult<RuleDescription> description = service.describeRule("virtual_machine", READER);
            assertTrue(description.isSuccess());

            OperationResult<List<String>> types = service.listResourceTypes(READER);
            assertTrue(types.value().contains("storage_account"));
            assertTrue(types.value().contains("default"));
        }

        @Test
        void syncRequiresAdmin() {
            String snapshot = "az = {\n  storage_account = \"sa\"\n}\n";

            assertEquals(ResultStatus.FORBIDDEN, service.syncSlugs(snapshot, ALICE).status());
            assertTrue(service.syncSlugs(snapshot, ADMIN).isSuccess());
            assertEquals("sa", service.lookupSlug("storage_account", READER).value().slug());
        }

        @Test
        void badSnapshotIsUpstreamError() {
            assertEquals(ResultStatus.UPSTREAM_ERROR, service.syncSlugs("nothing", ADMIN).status());
        }
    }

    @Nested
    @DisplayName("audit queries")
    class AuditQueries {

        private String name;

        @BeforeEach
        void claimAndRelease() {
            ClaimResult claimed = service.claim(storageAccount(), ALICE);
            name = claimed.name();
            service.release(ReleaseRequest.of("wus2", "prod", name, claimed.version()), ALICE);
            service.claim(ClaimRequest.builder().resourceType("key_vault").region("wus2").environment("prod").build(), BOB);
        }

        @Test
        void claimantSeesTrailOldestFirst() {
            OperationResult<List<AuditEntry>> trail = service.queryAudit("wus2", "prod", name, ALICE);

            assertTrue(trail.isSuccess());
            assertEquals(AuditAction.CLAIMED, trail.value().get(0).action());
            assertEquals(AuditAction.RELEASED, trail.value().get(1).action());
        }

        @Test
        void strangerCannotSeeTrail() {
            assertEquals(ResultStatus.FORBIDDEN, service.queryAudit("wus2", "prod", name, BOB).status());
            assertTrue(service.queryAudit("wus2", "prod", name, ADMIN).isSuccess());
        }

        @Test
        void bulkQueryDefaultsToCaller() {
            OperationResult<List<AuditEntry>> own = service.queryAuditBulk(AuditQuery.all(), BOB);

            assertTrue(own.isSuccess());
            assertEquals(1, own.value().size());
            assertEquals("bob", own.value().get(0).actor());
        }

        @Test
        void bulkQueryForOtherActorNeedsAdmin() {
            assertEquals(ResultStatus.FORBIDDEN,
                    service.queryAuditBulk("alice", null, null, null, null, null, BOB).status());

            OperationResult<List<AuditEntry>> admin =
                    service.queryAuditBulk("alice", null, null, null, null, null, ADMIN);
            assertEquals(2, admin.value().size());
            assertTrue(admin.value().stream().allMatch(e -> "alice".equals(e.actor())));
        }

        @Test
        @DisplayName("a caller whose actor has dots and an at sign can query their own trail")
        void emailStyleActorQueriesOwnTrail() {
            AuthContext jane = AuthContext.of("Jane.Doe@Corp", SecurityRole.CONTRIBUTOR);
            assertTrue(service.claim(ClaimRequest.builder().resourceType("key_vault")
                    .region("eus").environment("dev").build(), jane).isClaimed());

            OperationResult<List<AuditEntry>> own = service.queryAuditBulk(AuditQuery.all(), jane);

            assertTrue(own.isSuccess(), own.message());
            assertEquals(1, own.value().size());
            assertEquals("jane.doe@corp", own.value().get(0).actor());
        }

        @Test
        void adminSeesEverything() {
            assertEquals(3, service.queryAuditBulk(AuditQuery.all(), ADMIN).value().size());
        }

        @Test
        void malformedFilterIsInvalid() {
            assertEquals(ResultStatus.INVALID,
                    service.queryAuditBulk(null, null, null, "deleted", null, null, ADMIN).status());
        }
    }

    @Test
    void defaultsRoundTripPerSession() {
        service.saveDefaults(null, Map.of("region", "wus2"), ALICE);
        service.saveDefaults("s1", Map.of("environment", "dev"), ALICE);

        assertEquals(Map.of("region", "wus2", "environment", "dev"), service.getDefaults("s1", ALICE).value());
        assertEquals(Map.of("region", "wus2"), service.getDefaults(null, ALICE).value());
        assertEquals(ResultStatus.FORBIDDEN, service.saveDefaults(null, Map.of("region", "eus"), READER).status());
    }
}
