package ru.aritmos.clinicalboundary.abstraction;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Контракты слоя абстракции для клиентского ассистента.
 */
public final class AbstractionModels {

    private AbstractionModels() {
        // утилитарный класс
    }

    @Schema(description = "Гайд для клиента: обобщённые темы без клинической терминологии.")
    public record ClientSafeGuide(
            @Schema(description = "Темы (не более 5).")
            List<String> themes,
            @Schema(description = "Направления для исследования (не более 4).")
            List<String> explorationAreas,
            @Schema(description = "Одно предложение-фокус сессии.")
            String sessionFocus
    ) {
        public ClientSafeGuide {
            themes = themes == null ? List.of() : List.copyOf(themes);
            explorationAreas = explorationAreas == null ? List.of() : List.copyOf(explorationAreas);
            sessionFocus = sessionFocus == null ? "" : sessionFocus;
        }

        /**
         * @return весь текст гайда одной строкой (для остаточной проверки)
         */
        public String concatenated() {
            StringBuilder sb = new StringBuilder(sessionFocus);
            themes.forEach(t -> sb.append(' ').append(t));
            explorationAreas.forEach(e -> sb.append(' ').append(e));
            return sb.toString();
        }
    }

    /**
     * Результат абстракции. {@code strippedTerms} предназначены только для терапевтических/аудиторских представлений.
     */
    public record AbstractionResult(
            ClientSafeGuide guide,
            List<String> strippedTerms,
            int riskFlagsRemoved,
            boolean safe
    ) {
        public AbstractionResult {
            strippedTerms = strippedTerms == null ? List.of() : List.copyOf(strippedTerms);
        }
    }

    @Schema(description = "Вход клиентского ассистента. Это НЕ клинический анализ.")
    public record ClientSessionInput(
            List<String> themes,
            List<String> explorationAreas,
            String sessionFocus,
            @Schema(description = "Номер сессии (для преемственности).")
            Integer sessionNumber,
            @Schema(description = "Имя клиента для персонализации.")
            String clientFirstName
    ) {
        public ClientSessionInput {
            themes = themes == null ? List.of() : List.copyOf(themes);
            explorationAreas = explorationAreas == null ? List.of() : List.copyOf(explorationAreas);
        }
    }
}
