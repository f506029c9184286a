package ru.aritmos.clinicalboundary.anonymization;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Построитель исследовательских запросов из клинических меток.
 * <p>
 * Шаблоны фиксированы в таблицах ({@code anonymization.queryTemplates}); каждая отрендеренная строка
 * проходит через {@link QueryAnonymizer} до использования.
 */
@Singleton
public class ResearchQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(ResearchQueryBuilder.class);

    static final String DEFAULT_CONTEXT = "therapy";
    static final String DEFENSE_CONTEXT = "psychotherapy";

    private final BoundaryTablesStore tablesStore;
    private final QueryAnonymizer anonymizer;

    public ResearchQueryBuilder(BoundaryTablesStore tablesStore, QueryAnonymizer anonymizer) {
        this.tablesStore = tablesStore;
        this.anonymizer = anonymizer;
    }

    public String buildInterventionQuery(String framework) {
        return render("intervention", framework, null);
    }

    public String buildTechniqueQuery(String pattern) {
        return render("technique", pattern, null);
    }

    public String buildResearchQuery(String mechanism) {
        return buildResearchQuery(mechanism, DEFAULT_CONTEXT);
    }

    public String buildResearchQuery(String mechanism, String context) {
        return render("research", mechanism, context == null || context.isBlank() ? DEFAULT_CONTEXT : context);
    }

    public String buildCouplesQuery(String dynamic) {
        return render("couples", dynamic, null);
    }

    public String buildAttachmentQuery(String style) {
        return render("attachment", style, null);
    }

    /**
     * Построить пакет запросов по фреймворкам и защитным механизмам анализа.
     * <p>
     * Отклонённый анонимизатором запрос пропускается, пакет продолжает строиться.
     *
     * @param analysis анализ
     * @return безопасные запросы + счётчики
     */
    public AnonymizationModels.ResearchQueryBatch buildFromAnalysis(ClinicalModels.ClinicalAnalysis analysis) {
        List<String> queries = new ArrayList<>();
        int attempted = 0;
        int blocked = 0;

        for (ClinicalModels.FrameworkIdentification fw : analysis.frameworks()) {
            if (fw.name() == null || fw.name().isBlank()) {
                continue;
            }
            attempted++;
            try {
                queries.add(buildInterventionQuery(fw.name()));
            } catch (QueryAnonymizer.AnonymizationException e) {
                blocked++;
            }
        }
        for (ClinicalModels.BehavioralPattern p : analysis.behavioralPatterns()) {
            if (p.type() == null || p.type().isBlank()) {
                continue;
            }
            attempted++;
            try {
                queries.add(buildResearchQuery(p.type(), DEFENSE_CONTEXT));
            } catch (QueryAnonymizer.AnonymizationException e) {
                blocked++;
            }
        }

        if (blocked > 0) {
            log.warn("[ANONYMIZER] пакет запросов: пропущено небезопасных={} из {}", blocked, attempted);
        }
        return new AnonymizationModels.ResearchQueryBatch(queries, attempted, blocked);
    }

    private String render(String templateKey, String label, String context) {
        Map<String, String> templates = tablesStore.getEffective().anonymization().queryTemplates();
        String template = templates == null ? null : templates.get(templateKey);
        if (template == null) {
            throw new IllegalStateException("Не задан шаблон исследовательского запроса: " + templateKey);
        }
        String query = template
                .replace("{label}", label == null ? "" : label.trim())
                .replace("{context}", context == null ? "" : context.trim());
        return anonymizer.validateAndAnonymize(query);
    }
}
