package ru.aritmos.clinicalboundary.matching;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Контракты сопоставления тем пары.
 */
public final class TopicMatchModels {

    private TopicMatchModels() {
        // утилитарный класс
    }

    public enum MatchType {
        OVERLAP,
        COMPLEMENTARY,
        CONFLICT
    }

    @Schema(description = "Найденная связь между профилями партнёров.")
    public record TopicMatch(
            @Schema(description = "Тема или пара меток.")
            String topic,
            MatchType matchType,
            @Schema(description = "Уверенность 0..1.")
            double confidence,
            String description,
            @Schema(description = "Рекомендуемая область работы (если известна).")
            String focusArea
    ) {
    }

    @Schema(description = "Итог сопоставления двух изолированных профилей.")
    public record TopicMatchResult(
            List<TopicMatch> overlapping,
            List<TopicMatch> complementary,
            List<TopicMatch> conflicts,
            @Schema(description = "Области фокуса (не более 5).")
            List<String> suggestedFocusAreas,
            String summary
    ) {
        public TopicMatchResult {
            overlapping = overlapping == null ? List.of() : List.copyOf(overlapping);
            complementary = complementary == null ? List.of() : List.copyOf(complementary);
            conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
            suggestedFocusAreas = suggestedFocusAreas == null ? List.of() : List.copyOf(suggestedFocusAreas);
        }
    }
}
