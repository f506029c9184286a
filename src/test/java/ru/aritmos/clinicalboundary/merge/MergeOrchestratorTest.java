package ru.aritmos.clinicalboundary.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.clinicalboundary.config.BoundaryProperties;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.config.TestTables;
import ru.aritmos.clinicalboundary.core.BoundaryException;
import ru.aritmos.clinicalboundary.isolation.IsolationFilter;
import ru.aritmos.clinicalboundary.isolation.IsolationModels;
import ru.aritmos.clinicalboundary.matching.TopicMatchModels;
import ru.aritmos.clinicalboundary.matching.TopicMatcher;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MergeOrchestratorTest {

    private static final String THERAPIST = "11111111-1111-1111-1111-111111111111";
    private static final String OTHER_THERAPIST = "22222222-2222-2222-2222-222222222222";
    private static final String CLIENT_A = "aaaaaaaa-0000-0000-0000-00000000000a";
    private static final String CLIENT_B = "bbbbbbbb-0000-0000-0000-00000000000b";

    private final BoundaryTablesStore store = TestTables.store();

    private InMemoryCoupleLinkDirectory directory;
    private RecordingSink sink;
    private BoundaryProperties properties;
    private String linkId;

    /**
     * Приёмник аудита, запоминающий все записи.
     */
    static final class RecordingSink implements MergeAuditSink {
        final List<MergeModels.MergeAttemptRecord> records = Collections.synchronizedList(new ArrayList<>());

        @Override
        public String id() {
            return "recording";
        }

        @Override
        public void record(MergeModels.MergeAttemptRecord record) {
            records.add(record);
        }
    }

    /**
     * Фильтр изоляции, считающий вызовы.
     */
    static final class CountingIsolationFilter extends IsolationFilter {
        int calls;

        CountingIsolationFilter(BoundaryTablesStore store) {
            super(store);
        }

        @Override
        public IsolationModels.IsolatedPair isolateForCouplesMerge(ClinicalModels.ClinicalAnalysis partnerA,
                                                                  ClinicalModels.ClinicalAnalysis partnerB,
                                                                  boolean strictMode) {
            calls++;
            return super.isolateForCouplesMerge(partnerA, partnerB, strictMode);
        }
    }

    @BeforeEach
    void setUp() {
        directory = new InMemoryCoupleLinkDirectory();
        directory.registerClient(CLIENT_A, THERAPIST);
        directory.registerClient(CLIENT_B, THERAPIST);
        linkId = directory.createLink(CLIENT_A, CLIENT_B, THERAPIST, "intake notes").id();
        sink = new RecordingSink();
        properties = new BoundaryProperties();
    }

    private MergeOrchestrator orchestrator(IsolationFilter isolation, TopicMatcher matcher, MergeAuditSink auditSink) {
        return new MergeOrchestrator(directory, isolation, matcher, auditSink, store, properties);
    }

    private MergeOrchestrator orchestrator() {
        return orchestrator(new IsolationFilter(store), new TopicMatcher(store), sink);
    }

    private static ClinicalModels.ClinicalAnalysis partnerA() {
        return ClinicalModels.ClinicalAnalysis.builder()
                .framework("Anxious attachment", "attachment")
                .pattern("Protest behavior", "texted twelve times on Friday")
                .theme("Communication", "Trust")
                .riskFlag(ClinicalModels.RiskLevel.LOW, "Sleep disruption since the move")
                .build();
    }

    private static ClinicalModels.ClinicalAnalysis partnerB() {
        return ClinicalModels.ClinicalAnalysis.builder()
                .framework("Avoidant attachment", "attachment")
                .theme("Communication")
                .build();
    }

    private MergeModels.MergeRequest request(String link, String therapist) {
        return new MergeModels.MergeRequest(link, "session-1", therapist, partnerA(), partnerB(), "10.0.0.7");
    }

    @Test
    void anxiousAvoidantCoupleMergesIntoLabelsAndExercises() {
        MergeModels.MergedOutcome outcome = orchestrator().merge(request(linkId, THERAPIST));

        assertEquals(List.of("anxious attachment"), outcome.partnerALabels());
        assertEquals(List.of("avoidant attachment"), outcome.partnerBLabels());
        assertEquals(List.of("communication"), outcome.overlapping());
        assertEquals(List.of("anxious attachment / avoidant attachment"), outcome.complementary());
        assertTrue(outcome.conflicts().isEmpty());
        assertEquals(List.of(
                "Building shared communication",
                "Understanding attachment needs and creating safety",
                "Strengthening trust"), outcome.focusAreas());
        assertEquals(List.of(
                "Attachment awareness dialogue",
                "Safe haven practice",
                "Active listening practice",
                "Soft start-up exercise",
                "Trust-building actions list",
                "Transparency practice"), outcome.exercises());
        assertEquals("Analysis identified: 1 shared theme(s), 1 complementary dynamic(s).", outcome.summary());

        assertEquals(1, sink.records.size());
        MergeModels.MergeAttemptRecord r = sink.records.get(0);
        assertEquals(MergeModels.MergeAction.MERGE_COMPLETED, r.action());
        assertEquals(MergeModels.EVENT_TYPE, r.eventType());
        assertTrue(r.isolationInvoked());
        assertNull(r.failureKind());
        assertEquals(CLIENT_A, r.partnerAId());
        assertEquals(CLIENT_B, r.partnerBId());
        assertEquals("Merged 1 + 1 labels. Found 1 overlaps, 1 complementary patterns.", r.resultSummary());
        assertEquals(List.of("anxious attachment"), r.accessedLabels().get("partner_a").get("attachment_patterns"));
        assertEquals(List.of("communication", "trust"), r.accessedLabels().get("partner_a").get("theme_categories"));
        assertEquals("10.0.0.7", r.ipAddress());

        String snapshot = r.accessedLabels().toString().toLowerCase();
        assertFalse(snapshot.contains("protest"));
        assertFalse(snapshot.contains("friday"));
        assertFalse(snapshot.contains("sleep"));
    }

    @Test
    void storedAuditRecordCannotBeRewritten() {
        MergeOrchestrator orchestrator = orchestrator();
        orchestrator.merge(request(linkId, THERAPIST));

        MergeModels.MergeAttemptRecord r = orchestrator.getAuditLog(linkId).get(0);

        assertThrows(UnsupportedOperationException.class,
                () -> r.accessedLabels().get("partner_a").put("free_text", List.of("she said that on Monday")));
        assertThrows(UnsupportedOperationException.class,
                () -> r.accessedLabels().get("partner_a").get("theme_categories").add("argument last week"));
        assertThrows(UnsupportedOperationException.class,
                () -> r.accessedLabels().put("partner_c", Map.of()));
        assertEquals(List.of("partner_a", "partner_b"), new ArrayList<>(r.accessedLabels().keySet()));
        assertEquals(List.of("communication", "trust"),
                orchestrator.getAuditLog(linkId).get(0).accessedLabels().get("partner_a").get("theme_categories"));
    }

    @Test
    void concurrentMergesAppendOneRecordEach() throws Exception {
        int merges = 32;
        properties.getAudit().setInMemoryCapacity(merges);
        MergeOrchestrator orchestrator = orchestrator();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<MergeModels.MergedOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < merges; i++) {
                String sessionId = "session-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.merge(new MergeModels.MergeRequest(
                            linkId, sessionId, THERAPIST, partnerA(), partnerB(), null));
                }));
            }
            start.countDown();
            for (Future<MergeModels.MergedOutcome> f : futures) {
                assertNotNull(f.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        List<MergeModels.MergeAttemptRecord> log = orchestrator.getAuditLog(null);
        assertEquals(merges, log.size());
        assertEquals(merges, sink.records.size());
        assertTrue(log.stream().allMatch(MergeModels.MergeAttemptRecord::isolationInvoked));
        assertTrue(log.stream().allMatch(MergeModels.MergeAttemptRecord::succeeded));
        assertEquals(merges, log.stream().map(MergeModels.MergeAttemptRecord::sessionId).distinct().count());
        assertEquals(merges, orchestrator.recentAttempts(merges).size());
    }

    @Test
    void failureInsideMatchingProducesSingleFailedRecord() {
        TopicMatcher broken = new TopicMatcher(store) {
            @Override
            public TopicMatchModels.TopicMatchResult match(IsolationModels.IsolatedProfile a, IsolationModels.IsolatedProfile b) {
                throw new IllegalStateException("matcher broke near 555-123-4567");
            }
        };
        MergeOrchestrator orchestrator = orchestrator(new IsolationFilter(store), broken, sink);

        MergeOrchestrator.MergeEngineException e = assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(request(linkId, THERAPIST)));

        assertEquals(BoundaryException.Kind.ORCHESTRATION, e.kind());
        assertEquals("MERGE_FAILED", e.errorCode());
        assertEquals(MergeModels.MergeStage.MATCH, e.stage());
        assertInstanceOf(IllegalStateException.class, e.getCause());

        List<MergeModels.MergeAttemptRecord> log = orchestrator.getAuditLog(linkId);
        assertEquals(1, log.size());
        MergeModels.MergeAttemptRecord r = log.get(0);
        assertEquals(MergeModels.MergeAction.MERGE_FAILED, r.action());
        assertEquals("ORCHESTRATION", r.failureKind());
        assertEquals(MergeModels.MergeStage.MATCH, r.lastStage());
        assertTrue(r.isolationInvoked());
        assertFalse(r.accessedLabels().isEmpty());
        assertFalse(r.errorMessage().contains("555-123-4567"));
        assertEquals(1, sink.records.size());
    }

    @Test
    void otherTherapistIsDeniedBeforeIsolation() {
        CountingIsolationFilter isolation = new CountingIsolationFilter(store);
        MergeOrchestrator orchestrator = orchestrator(isolation, new TopicMatcher(store), sink);

        MergeOrchestrator.MergeEngineException e = assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(request(linkId, OTHER_THERAPIST)));

        assertEquals(BoundaryException.Kind.AUTHORIZATION, e.kind());
        assertEquals("COUPLE_LINK_NOT_OWNED", e.errorCode());
        assertEquals(MergeModels.MergeStage.AUTHORIZE, e.stage());
        assertEquals(0, isolation.calls);

        MergeModels.MergeAttemptRecord r = sink.records.get(0);
        assertEquals(MergeModels.MergeAction.MERGE_DENIED, r.action());
        assertEquals("AUTHORIZATION", r.failureKind());
        assertTrue(r.errorMessage().startsWith("Authorization error: "));
        assertTrue(r.accessedLabels().isEmpty());
    }

    @Test
    void pausedLinkIsDenied() {
        directory.pauseLink(linkId, THERAPIST);

        MergeOrchestrator orchestrator = orchestrator();
        MergeOrchestrator.MergeEngineException e = assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(request(linkId, THERAPIST)));

        assertEquals("COUPLE_LINK_NOT_ACTIVE", e.errorCode());
        assertEquals("Authorization error: Link is not active: paused", sink.records.get(0).errorMessage());
    }

    @Test
    void unknownLinkIsAuditedWithoutPartnerIds() {
        String unknown = "00000000-0000-0000-0000-000000000001";
        MergeOrchestrator orchestrator = orchestrator();

        MergeOrchestrator.MergeEngineException e = assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(request(unknown, THERAPIST)));

        assertEquals("COUPLE_LINK_NOT_FOUND", e.errorCode());
        assertEquals(1, sink.records.size());
        MergeModels.MergeAttemptRecord r = sink.records.get(0);
        assertEquals(MergeModels.MergeAction.MERGE_DENIED, r.action());
        assertNull(r.partnerAId());
        assertNull(r.partnerBId());
        assertTrue(r.errorMessage().startsWith("Authorization error: Link not found"));
        assertFalse(r.errorMessage().contains(unknown));
    }

    @Test
    void verificationFailureIsRecordedAsBlocked() {
        BoundaryTablesStore misconfigured = TestTables.storeWithExtraThemes("argument last week");
        MergeOrchestrator orchestrator = new MergeOrchestrator(directory, new IsolationFilter(misconfigured),
                new TopicMatcher(misconfigured), sink, misconfigured, properties);
        ClinicalModels.ClinicalAnalysis a = ClinicalModels.ClinicalAnalysis.builder().theme("Argument last week").build();

        MergeOrchestrator.MergeEngineException e = assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(new MergeModels.MergeRequest(linkId, "session-2", THERAPIST, a, partnerB(), null)));

        assertEquals(BoundaryException.Kind.CONTENT_SAFETY, e.kind());
        assertEquals("ISOLATION_VIOLATION", e.errorCode());
        assertEquals(MergeModels.MergeStage.ISOLATE, e.stage());

        MergeModels.MergeAttemptRecord r = sink.records.get(0);
        assertEquals(MergeModels.MergeAction.MERGE_BLOCKED, r.action());
        assertEquals("CONTENT_SAFETY", r.failureKind());
        assertTrue(r.errorMessage().startsWith("Isolation violation: "));
        assertEquals("unknown", r.ipAddress());
    }

    @Test
    void relaxedIsolationLetsMisconfiguredLabelThrough() {
        properties.getIsolation().setStrictMode(false);
        BoundaryTablesStore misconfigured = TestTables.storeWithExtraThemes("argument last week");
        MergeOrchestrator orchestrator = new MergeOrchestrator(directory, new IsolationFilter(misconfigured),
                new TopicMatcher(misconfigured), sink, misconfigured, properties);
        ClinicalModels.ClinicalAnalysis a = ClinicalModels.ClinicalAnalysis.builder().theme("Argument last week").build();

        orchestrator.merge(new MergeModels.MergeRequest(linkId, "session-2", THERAPIST, a, partnerB(), null));

        assertEquals(MergeModels.MergeAction.MERGE_COMPLETED, sink.records.get(0).action());
    }

    @Test
    void nullRequestIsRejectedWithoutAudit() {
        MergeOrchestrator orchestrator = orchestrator();

        assertThrows(IllegalArgumentException.class, () -> orchestrator.merge(null));
        assertTrue(sink.records.isEmpty());
        assertTrue(orchestrator.getAuditLog(null).isEmpty());
    }

    @Test
    void auditLogIsBoundedAndRecentAttemptsAreNewestFirst() {
        properties.getAudit().setInMemoryCapacity(2);
        MergeOrchestrator orchestrator = orchestrator();

        orchestrator.merge(request(linkId, THERAPIST));
        assertThrows(MergeOrchestrator.MergeEngineException.class,
                () -> orchestrator.merge(request(linkId, OTHER_THERAPIST)));
        orchestrator.merge(request(linkId, THERAPIST));

        List<MergeModels.MergeAttemptRecord> log = orchestrator.getAuditLog(null);
        assertEquals(2, log.size());
        assertEquals(MergeModels.MergeAction.MERGE_DENIED, log.get(0).action());
        assertEquals(MergeModels.MergeAction.MERGE_COMPLETED, log.get(1).action());

        List<MergeModels.MergeAttemptRecord> recent = orchestrator.recentAttempts(0);
        assertEquals(log.get(1).id(), recent.get(0).id());
        assertEquals(1, orchestrator.recentAttempts(1).size());

        assertEquals(1, orchestrator.getMergeHistory(linkId).size());
        assertEquals(3, sink.records.size());
    }

    @Test
    void failingSinkDoesNotBreakMerge() {
        MergeAuditSink failing = new MergeAuditSink() {
            @Override
            public String id() {
                return "failing";
            }

            @Override
            public void record(MergeModels.MergeAttemptRecord record) {
                throw new IllegalStateException("storage unavailable");
            }
        };
        MergeOrchestrator orchestrator = orchestrator(new IsolationFilter(store), new TopicMatcher(store), failing);

        MergeModels.MergedOutcome outcome = orchestrator.merge(request(linkId, THERAPIST));

        assertNotNull(outcome.id());
        assertEquals(1, orchestrator.getAuditLog(linkId).size());
    }

    @Test
    void exercisesAreCappedAndGroupedByTrigger() {
        MergeOrchestrator orchestrator = orchestrator();
        IsolationModels.IsolatedProfile a = new IsolationModels.IsolatedProfile(List.of(), List.of(),
                List.of("intimacy", "conflict"), List.of(), List.of(), List.of("stonewalling"));
        IsolationModels.IsolatedProfile b = new IsolationModels.IsolatedProfile(List.of(), List.of(),
                List.of("intimacy"), List.of(), List.of(), List.of("criticism"));
        TopicMatchModels.TopicMatchResult match = new TopicMatcher(store).match(a, b);

        assertEquals(List.of(
                "Love maps questionnaire",
                "Fondness and admiration sharing",
                "Time-out protocol",
                "De-escalation breathing"), orchestrator.deriveExercises(a, b, match));
    }

    @Test
    void requestRequiresBothAnalyses() {
        assertThrows(NullPointerException.class,
                () -> new MergeModels.MergeRequest(linkId, "s", THERAPIST, null, partnerB(), null));
    }
}
