package ru.aritmos.clinicalboundary.anonymization;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.core.BoundaryOutcome;
import ru.aritmos.clinicalboundary.core.SensitiveDataSanitizer;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Исследовательский слой поверх {@link ExternalResearchClient}.
 * <p>
 * Каждый запрос строится {@link ResearchQueryBuilder} и анонимизируется до обращения к клиенту.
 * Если анонимизатор отклонил запрос, клиент не вызывается вовсе.
 */
@Singleton
public class ResearchService {

    private static final Logger log = LoggerFactory.getLogger(ResearchService.class);

    private static final List<String> TECHNIQUE_WORDS = List.of(
            "technique", "approach", "intervention", "strategy", "method", "practice", "exercise", "skill", "tool");
    private static final List<String> FINDING_WORDS = List.of("research", "study", "found", "shows", "evidence");
    private static final int MAX_EXTRACTED = 5;

    private final ResearchQueryBuilder queryBuilder;
    private final ExternalResearchClient client;

    public ResearchService(ResearchQueryBuilder queryBuilder, ExternalResearchClient client) {
        this.queryBuilder = queryBuilder;
        this.client = client;
    }

    /**
     * Доказательные интервенции для фреймворка.
     */
    public BoundaryOutcome<AnonymizationModels.ResearchResult> researchFramework(String frameworkName) {
        return research(frameworkName, queryBuilder::buildInterventionQuery);
    }

    /**
     * Клинические исследования по защитному механизму.
     */
    public BoundaryOutcome<AnonymizationModels.ResearchResult> researchDefenseMechanism(String mechanism) {
        return research(mechanism, m -> queryBuilder.buildResearchQuery(m, ResearchQueryBuilder.DEFENSE_CONTEXT));
    }

    /**
     * Подходы парной терапии для динамики пары.
     */
    public BoundaryOutcome<AnonymizationModels.ResearchResult> researchRelationshipPattern(String pattern) {
        return research(pattern, queryBuilder::buildCouplesQuery);
    }

    /**
     * Исследовать все фреймворки и защитные механизмы анализа.
     * <p>
     * Отказ по одной метке не прерывает пакет.
     */
    public AnonymizationModels.ResearchBatch researchAnalysis(ClinicalModels.ClinicalAnalysis analysis) {
        List<AnonymizationModels.ResearchResult> results = new ArrayList<>();
        int total = 0;
        int blocked = 0;
        int failed = 0;

        List<BoundaryOutcome<AnonymizationModels.ResearchResult>> outcomes = new ArrayList<>();
        for (ClinicalModels.FrameworkIdentification fw : analysis.frameworks()) {
            if (fw.name() != null && !fw.name().isBlank()) {
                outcomes.add(researchFramework(fw.name()));
            }
        }
        for (ClinicalModels.BehavioralPattern p : analysis.behavioralPatterns()) {
            if (p.type() != null && !p.type().isBlank()) {
                outcomes.add(researchDefenseMechanism(p.type()));
            }
        }

        for (BoundaryOutcome<AnonymizationModels.ResearchResult> o : outcomes) {
            total++;
            if (o.success()) {
                results.add(o.result());
            } else if ("REJECTED".equals(o.outcome())) {
                blocked++;
            } else {
                failed++;
            }
        }
        log.info("[RESEARCH] пакет: total={} successful={} blocked={} failed={} client={}",
                total, results.size(), blocked, failed, client.clientId());
        return new AnonymizationModels.ResearchBatch(results, total, results.size(), failed, blocked);
    }

    private BoundaryOutcome<AnonymizationModels.ResearchResult> research(String label, Function<String, String> builder) {
        String query;
        try {
            query = builder.apply(label);
        } catch (QueryAnonymizer.AnonymizationException e) {
            log.warn("[RESEARCH] запрос заблокирован анонимизатором code={}", e.errorCode());
            return BoundaryOutcome.rejected(e);
        }

        BoundaryOutcome<AnonymizationModels.ResearchResponse> response;
        try {
            response = client.search(query);
        } catch (RuntimeException e) {
            log.warn("[RESEARCH] сбой обращения к исследовательскому API client={} error={}",
                    client.clientId(), SensitiveDataSanitizer.describe(e));
            return BoundaryOutcome.error("RESEARCH_CLIENT_FAILED", "Исследовательский API вернул ошибку",
                    Map.of("error", e.getClass().getSimpleName()));
        }
        if (response == null) {
            return BoundaryOutcome.error("RESEARCH_EMPTY_RESPONSE", "Исследовательский API вернул пустой ответ", Map.of());
        }
        if (!response.success()) {
            log.info("[RESEARCH] обращение не выполнено outcome={} code={} client={}",
                    response.outcome(), response.errorCode(), client.clientId());
            return new BoundaryOutcome<>(false, response.outcome(), response.errorCode(), response.message(), null,
                    response.details());
        }

        AnonymizationModels.ResearchResponse r = response.result();
        List<String> findings = new ArrayList<>();
        List<String> techniques = new ArrayList<>();
        extractFindings(r.answer(), findings, techniques);
        return BoundaryOutcome.ok(
                new AnonymizationModels.ResearchResult(query, r.citations(), findings, techniques, r.cached()),
                Map.of("citations", r.citations().size()));
    }

    /**
     * Разбить ответ на предложения и классифицировать их как технику или вывод.
     */
    static void extractFindings(String text, List<String> findings, List<String> techniques) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (String raw : text.replace('\n', ' ').split("\\. ")) {
            String sentence = raw.trim();
            if (sentence.isEmpty()) {
                continue;
            }
            if (sentence.endsWith(".")) {
                sentence = sentence.substring(0, sentence.length() - 1);
            }
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (TECHNIQUE_WORDS.stream().anyMatch(lower::contains)) {
                if (techniques.size() < MAX_EXTRACTED) {
                    techniques.add(sentence + ".");
                }
            } else if (FINDING_WORDS.stream().anyMatch(lower::contains)) {
                if (findings.size() < MAX_EXTRACTED) {
                    findings.add(sentence + ".");
                }
            }
        }
    }
}
