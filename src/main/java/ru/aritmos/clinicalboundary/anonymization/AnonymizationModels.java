package ru.aritmos.clinicalboundary.anonymization;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Контракты анонимизации запросов и исследовательского слоя.
 */
public final class AnonymizationModels {

    private AnonymizationModels() {
        // утилитарный класс
    }

    /**
     * Категория, фиксируемая при срабатывании блокирующего паттерна (явное самораскрытие).
     */
    public static final String BLOCKING_CATEGORY = "blocking_pattern";

    @Schema(description = "Результат анонимизации запроса для внешнего поискового API.")
    public record AnonymizationOutcome(
            @Schema(description = "Исходный запрос.")
            String originalQuery,
            @Schema(description = "Редактированный кандидат. Используется только при safe=true.")
            String anonymizedQuery,
            @Schema(description = "Найденные категории PHI в порядке обнаружения.")
            List<String> categories,
            @Schema(description = "Признак допустимости передачи во внешний API.")
            boolean safe,
            @Schema(description = "Причина отклонения (если safe=false).")
            String rejectionReason
    ) {
        public AnonymizationOutcome {
            categories = categories == null ? List.of() : List.copyOf(categories);
        }

        public boolean phiDetected() {
            return !categories.isEmpty();
        }
    }

    /**
     * Пакет запросов, построенных из анализа. Отклонённые элементы пропущены и только посчитаны.
     */
    public record ResearchQueryBatch(List<String> queries, int attempted, int blocked) {
        public ResearchQueryBatch {
            queries = queries == null ? List.of() : List.copyOf(queries);
        }
    }

    @Schema(description = "Цитата/источник из ответа поискового API.")
    public record Citation(String title, String source, String url) {
    }

    @Schema(description = "Ответ внешнего поискового API.")
    public record ResearchResponse(String answer, List<Citation> citations, boolean cached) {
        public ResearchResponse {
            citations = citations == null ? List.of() : List.copyOf(citations);
        }
    }

    @Schema(description = "Результат исследования по одной метке.")
    public record ResearchResult(
            @Schema(description = "Отправленный (анонимизированный) запрос.")
            String anonymizedQuery,
            List<Citation> citations,
            @Schema(description = "Ключевые выводы (не более 5).")
            List<String> keyFindings,
            @Schema(description = "Рекомендуемые техники (не более 5).")
            List<String> recommendedTechniques,
            boolean cached
    ) {
        public ResearchResult {
            citations = citations == null ? List.of() : List.copyOf(citations);
            keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
            recommendedTechniques = recommendedTechniques == null ? List.of() : List.copyOf(recommendedTechniques);
        }
    }

    /**
     * Итог пакетного исследования.
     *
     * @param results успешные результаты
     * @param total сколько меток было обработано
     * @param successful успешных обращений
     * @param failed сбоев внешнего API (в т.ч. клиент не настроен)
     * @param blocked запросов, отклонённых анонимизатором
     */
    public record ResearchBatch(List<ResearchResult> results, int total, int successful, int failed, int blocked) {
        public ResearchBatch {
            results = results == null ? List.of() : List.copyOf(results);
        }
    }
}
