package ru.aritmos.clinicalboundary.merge;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.config.BoundaryProperties;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.core.BoundaryException;
import ru.aritmos.clinicalboundary.core.SensitiveDataSanitizer;
import ru.aritmos.clinicalboundary.isolation.IsolationFilter;
import ru.aritmos.clinicalboundary.isolation.IsolationModels;
import ru.aritmos.clinicalboundary.matching.TopicMatchModels;
import ru.aritmos.clinicalboundary.matching.TopicMatcher;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Оркестратор слияния профилей пары.
 * <p>
 * Конвейер без перестановок: {@code authorize → isolate → match → derive_exercises → build_outcome → audit}.
 * Любой сбой переводит попытку в аудит отказа и выбрасывает {@link MergeEngineException} с исходной причиной.
 * <p>
 * Важно:
 * <ul>
 *   <li>изоляцию всегда вызывает сам оркестратор на сырых анализах; принять готовый профиль нельзя;</li>
 *   <li>на каждый вызов {@link #merge} создаётся ровно одна {@link MergeModels.MergeAttemptRecord}, и её флаг
 *       {@code isolationInvoked} всегда true;</li>
 *   <li>журнал попыток в памяти процесса ограничен по размеру, запись и чтение сериализованы одной блокировкой.</li>
 * </ul>
 */
@Singleton
public class MergeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MergeOrchestrator.class);

    static final int MAX_EXERCISES = 6;
    static final int EXERCISES_PER_GROUP = 2;

    private final CoupleLinkDirectory directory;
    private final IsolationFilter isolationFilter;
    private final TopicMatcher topicMatcher;
    private final MergeAuditSink auditSink;
    private final BoundaryTablesStore tablesStore;
    private final BoundaryProperties properties;

    private final Object auditLock = new Object();
    private final Deque<MergeModels.MergeAttemptRecord> auditLog = new ArrayDeque<>();

    public MergeOrchestrator(CoupleLinkDirectory directory,
                             IsolationFilter isolationFilter,
                             TopicMatcher topicMatcher,
                             MergeAuditSink auditSink,
                             BoundaryTablesStore tablesStore,
                             BoundaryProperties properties) {
        this.directory = directory;
        this.isolationFilter = isolationFilter;
        this.topicMatcher = topicMatcher;
        this.auditSink = auditSink;
        this.tablesStore = tablesStore;
        this.properties = properties;
    }

    /**
     * Ошибка слияния. {@link #kind()} совпадает с классом исходной причины.
     */
    public static final class MergeEngineException extends BoundaryException {

        private final MergeModels.MergeStage stage;

        public MergeEngineException(Kind kind, String errorCode, MergeModels.MergeStage stage, String message, Throwable cause) {
            super(kind, errorCode, message, cause);
            this.stage = stage;
        }

        public MergeModels.MergeStage stage() {
            return stage;
        }
    }

    /**
     * Выполнить слияние.
     *
     * @param request запрос с сырыми анализами партнёров
     * @return результат слияния
     * @throws MergeEngineException при любом сбое (после записи аудита)
     */
    public MergeModels.MergedOutcome merge(MergeModels.MergeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Merge request is required");
        }
        Attempt attempt = new Attempt(request);
        try {
            attempt.stage = MergeModels.MergeStage.AUTHORIZE;
            CoupleLinkModels.CoupleLink link = directory.getLink(request.coupleLinkId());
            attempt.partnerAId = link.partnerAId();
            attempt.partnerBId = link.partnerBId();
            if (!directory.validateMergeAuthorization(request.coupleLinkId(), request.therapistId())) {
                throw new CoupleLinkDirectory.CoupleLinkException(
                        CoupleLinkDirectory.CoupleLinkException.Reason.NOT_OWNED, "Not authorized for this couple link");
            }

            attempt.stage = MergeModels.MergeStage.ISOLATE;
            boolean strict = properties == null || properties.getIsolation().isStrictMode();
            IsolationModels.IsolatedPair pair = isolationFilter.isolateForCouplesMerge(
                    request.partnerAAnalysis(), request.partnerBAnalysis(), strict);
            attempt.accessedLabels = accessedSnapshot(pair);

            attempt.stage = MergeModels.MergeStage.MATCH;
            TopicMatchModels.TopicMatchResult match = topicMatcher.match(pair.profileA(), pair.profileB());

            attempt.stage = MergeModels.MergeStage.DERIVE_EXERCISES;
            List<String> exercises = deriveExercises(pair.profileA(), pair.profileB(), match);

            attempt.stage = MergeModels.MergeStage.BUILD_OUTCOME;
            MergeModels.MergedOutcome outcome = new MergeModels.MergedOutcome(
                    UUID.randomUUID().toString(),
                    request.coupleLinkId(),
                    request.sessionId(),
                    combinedLabels(pair.profileA()),
                    combinedLabels(pair.profileB()),
                    topics(match.overlapping()),
                    topics(match.complementary()),
                    topics(match.conflicts()),
                    match.suggestedFocusAreas(),
                    exercises,
                    match.summary(),
                    Instant.now());

            attempt.stage = MergeModels.MergeStage.AUDIT;
            String summary = "Merged " + outcome.partnerALabels().size() + " + " + outcome.partnerBLabels().size()
                    + " labels. Found " + outcome.overlapping().size() + " overlaps, "
                    + outcome.complementary().size() + " complementary patterns.";
            append(attempt.toRecord(MergeModels.MergeAction.MERGE_COMPLETED, null, summary, null));
            log.info("[MERGE] слияние выполнено coupleLinkId={} sessionId={} overlaps={} complementary={} conflicts={} exercises={}",
                    request.coupleLinkId(), request.sessionId(), outcome.overlapping().size(),
                    outcome.complementary().size(), outcome.conflicts().size(), outcome.exercises().size());
            return outcome;
        } catch (BoundaryException e) {
            MergeModels.MergeAction action = switch (e.kind()) {
                case AUTHORIZATION -> MergeModels.MergeAction.MERGE_DENIED;
                case CONTENT_SAFETY -> MergeModels.MergeAction.MERGE_BLOCKED;
                case ORCHESTRATION -> MergeModels.MergeAction.MERGE_FAILED;
            };
            String prefix = e.kind() == BoundaryException.Kind.AUTHORIZATION ? "Authorization error: "
                    : e.kind() == BoundaryException.Kind.CONTENT_SAFETY ? "Isolation violation: " : "Merge failed: ";
            append(attempt.toRecord(action, e.kind().name(), null, SensitiveDataSanitizer.sanitizeText(prefix + e.getMessage())));
            log.warn("[MERGE] слияние не выполнено action={} code={} stage={} coupleLinkId={}",
                    action, e.errorCode(), attempt.stage, request.coupleLinkId());
            throw new MergeEngineException(e.kind(), e.errorCode(), attempt.stage,
                    "Merge aborted at stage " + attempt.stage + ": " + e.errorCode(), e);
        } catch (RuntimeException e) {
            append(attempt.toRecord(MergeModels.MergeAction.MERGE_FAILED, BoundaryException.Kind.ORCHESTRATION.name(),
                    null, SensitiveDataSanitizer.describe(e)));
            log.error("[MERGE] сбой слияния stage={} coupleLinkId={} error={}",
                    attempt.stage, request.coupleLinkId(), e.getClass().getSimpleName());
            throw new MergeEngineException(BoundaryException.Kind.ORCHESTRATION, "MERGE_FAILED", attempt.stage,
                    "Merge failed at stage " + attempt.stage, e);
        }
    }

    /**
     * Журнал попыток в порядке записи.
     *
     * @param coupleLinkId фильтр по связке ({@code null}: все)
     */
    public List<MergeModels.MergeAttemptRecord> getAuditLog(String coupleLinkId) {
        synchronized (auditLock) {
            return auditLog.stream()
                    .filter(r -> coupleLinkId == null || coupleLinkId.equals(r.coupleLinkId()))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Успешные слияния связки.
     */
    public List<MergeModels.MergeAttemptRecord> getMergeHistory(String coupleLinkId) {
        return getAuditLog(coupleLinkId).stream()
                .filter(MergeModels.MergeAttemptRecord::succeeded)
                .collect(Collectors.toList());
    }

    /**
     * Последние попытки, новые первыми.
     */
    public List<MergeModels.MergeAttemptRecord> recentAttempts(int limit) {
        int lim = limit <= 0 ? 50 : limit;
        List<MergeModels.MergeAttemptRecord> out = new ArrayList<>();
        synchronized (auditLock) {
            Iterator<MergeModels.MergeAttemptRecord> it = auditLog.descendingIterator();
            while (it.hasNext() && out.size() < lim) {
                out.add(it.next());
            }
        }
        return out;
    }

    /**
     * До двух упражнений на каждую сработавшую группу в порядке таблицы, без повторов, не более шести.
     */
    List<String> deriveExercises(IsolationModels.IsolatedProfile a,
                                 IsolationModels.IsolatedProfile b,
                                 TopicMatchModels.TopicMatchResult match) {
        BoundaryTables tables = tablesStore.getEffective();
        BoundaryTables.MatchingSection cfg = tables.matching();

        Set<String> themes = new LinkedHashSet<>(a.themeCategories());
        themes.addAll(b.themeCategories());

        Set<String> out = new LinkedHashSet<>();
        for (BoundaryTables.ExerciseGroup group : tables.exercises()) {
            if (group.trigger() == null || !triggered(group, a, b, themes, match, cfg)) {
                continue;
            }
            BoundaryTables.nullSafe(group.items()).stream().limit(EXERCISES_PER_GROUP).forEach(out::add);
        }
        return out.stream().limit(MAX_EXERCISES).collect(Collectors.toList());
    }

    private static boolean triggered(BoundaryTables.ExerciseGroup group,
                                     IsolationModels.IsolatedProfile a,
                                     IsolationModels.IsolatedProfile b,
                                     Set<String> themes,
                                     TopicMatchModels.TopicMatchResult match,
                                     BoundaryTables.MatchingSection cfg) {
        return switch (group.trigger()) {
            case ATTACHMENT_PAIR -> (anyOf(a.attachmentPatterns(), cfg.anxiousPatterns()) && anyOf(b.attachmentPatterns(), cfg.avoidantPatterns()))
                    || (anyOf(b.attachmentPatterns(), cfg.anxiousPatterns()) && anyOf(a.attachmentPatterns(), cfg.avoidantPatterns()));
            case THEME -> themes.contains(group.category());
            case CONFLICT -> !match.conflicts().isEmpty();
        };
    }

    private static boolean anyOf(List<String> labels, List<String> candidates) {
        return BoundaryTables.nullSafe(candidates).stream().anyMatch(labels::contains);
    }

    private static List<String> combinedLabels(IsolationModels.IsolatedProfile p) {
        Set<String> out = new LinkedHashSet<>(p.attachmentPatterns());
        out.addAll(p.frameworks());
        out.addAll(p.defensePatterns());
        out.addAll(p.communicationPatterns());
        return new ArrayList<>(out);
    }

    private static List<String> topics(List<TopicMatchModels.TopicMatch> matches) {
        return matches.stream().map(TopicMatchModels.TopicMatch::topic).collect(Collectors.toList());
    }

    private static Map<String, Map<String, List<String>>> accessedSnapshot(IsolationModels.IsolatedPair pair) {
        Map<String, Map<String, List<String>>> out = new LinkedHashMap<>();
        out.put("partner_a", byCode(pair.profileA()));
        out.put("partner_b", byCode(pair.profileB()));
        return out;
    }

    private static Map<String, List<String>> byCode(IsolationModels.IsolatedProfile p) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        p.byCategory().forEach((c, labels) -> out.put(c.code(), labels));
        return out;
    }

    private void append(MergeModels.MergeAttemptRecord record) {
        int capacity = properties == null ? 1000 : properties.getAudit().getInMemoryCapacity();
        synchronized (auditLock) {
            auditLog.addLast(record);
            while (auditLog.size() > Math.max(1, capacity)) {
                auditLog.removeFirst();
            }
        }
        try {
            auditSink.record(record);
        } catch (RuntimeException e) {
            log.error("[AUDIT] приёмник аудита не принял запись sink={} recordId={} action={} error={}",
                    auditSink.id(), record.id(), record.action(), SensitiveDataSanitizer.describe(e));
        }
    }

    /**
     * Состояние одной попытки для записи аудита.
     */
    private static final class Attempt {
        private final MergeModels.MergeRequest request;
        private MergeModels.MergeStage stage = MergeModels.MergeStage.AUTHORIZE;
        private String partnerAId;
        private String partnerBId;
        private Map<String, Map<String, List<String>>> accessedLabels = Map.of();

        private Attempt(MergeModels.MergeRequest request) {
            this.request = request;
        }

        private MergeModels.MergeAttemptRecord toRecord(MergeModels.MergeAction action,
                                                       String failureKind,
                                                       String resultSummary,
                                                       String errorMessage) {
            return new MergeModels.MergeAttemptRecord(
                    UUID.randomUUID().toString(),
                    MergeModels.EVENT_TYPE,
                    request.coupleLinkId(),
                    request.sessionId(),
                    request.therapistId(),
                    partnerAId,
                    partnerBId,
                    action,
                    failureKind,
                    stage,
                    true,
                    accessedLabels,
                    resultSummary,
                    errorMessage,
                    request.ipAddress(),
                    Instant.now());
        }
    }
}
