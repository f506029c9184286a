package ru.aritmos.clinicalboundary.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Контракты входного клинического анализа.
 * <p>
 * {@link ClinicalAnalysis}: полный, ещё не редуцированный результат upstream-анализа. Он принадлежит
 * вызывающему пайплайну и никогда не сохраняется внутри ядра границы.
 * <p>
 * Важно:
 * <ul>
 *   <li>все записи неизменяемы: списки копируются при создании;</li>
 *   <li>поля evidence/indicators/context/description: свободный текст; фильтр изоляции их не читает.</li>
 * </ul>
 */
public final class ClinicalModels {

    private ClinicalModels() {
        // утилитарный класс
    }

    @Schema(description = "Уровень риска клинического флага.")
    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH
    }

    @Schema(description = "Идентифицированный психологический фреймворк/паттерн.")
    public record FrameworkIdentification(
            @Schema(description = "Название фреймворка или паттерна.")
            String name,
            @Schema(description = "Уверенность 0..1.")
            double confidence,
            @Schema(description = "Свидетельство из транскрипта (свободный текст).")
            String evidence,
            @Schema(description = "Категория (attachment/defense/communication/relationship/...).")
            String category
    ) {
        public FrameworkIdentification {
            confidence = clamp(confidence);
        }
    }

    @Schema(description = "Наблюдение поведенческого паттерна (защитный механизм и т.п.).")
    public record BehavioralPattern(
            @Schema(description = "Тип паттерна.")
            String type,
            @Schema(description = "Фразы-индикаторы (свободный текст).")
            List<String> indicators,
            @Schema(description = "Контекст наблюдения (свободный текст).")
            String context
    ) {
        public BehavioralPattern {
            indicators = copy(indicators);
        }
    }

    @Schema(description = "Клинический флаг риска. Только для терапевта.")
    public record RiskFlag(
            RiskLevel level,
            String description,
            String recommendedAction
    ) {
    }

    @Schema(description = "Полный клинический анализ одной сессии/одного клиента.")
    public record ClinicalAnalysis(
            List<FrameworkIdentification> frameworks,
            List<BehavioralPattern> behavioralPatterns,
            List<RiskFlag> riskFlags,
            List<String> keyThemes,
            List<String> suggestedExplorations,
            List<String> sessionQuestions,
            double overallConfidence
    ) {
        public ClinicalAnalysis {
            frameworks = copy(frameworks);
            behavioralPatterns = copy(behavioralPatterns);
            riskFlags = copy(riskFlags);
            keyThemes = copy(keyThemes);
            suggestedExplorations = copy(suggestedExplorations);
            sessionQuestions = copy(sessionQuestions);
            overallConfidence = clamp(overallConfidence);
        }

        public static Builder builder() {
            return new Builder();
        }
    }

    /**
     * Построитель анализа для пайплайнов и тестов.
     */
    public static final class Builder {
        private final List<FrameworkIdentification> frameworks = new ArrayList<>();
        private final List<BehavioralPattern> patterns = new ArrayList<>();
        private final List<RiskFlag> riskFlags = new ArrayList<>();
        private final List<String> themes = new ArrayList<>();
        private final List<String> explorations = new ArrayList<>();
        private final List<String> questions = new ArrayList<>();
        private double confidence = 0.5;

        private Builder() {
        }

        public Builder framework(String name, String category) {
            frameworks.add(new FrameworkIdentification(name, 0.8, "", category));
            return this;
        }

        public Builder framework(FrameworkIdentification f) {
            frameworks.add(f);
            return this;
        }

        public Builder pattern(String type, String... indicators) {
            patterns.add(new BehavioralPattern(type, List.of(indicators), null));
            return this;
        }

        public Builder riskFlag(RiskLevel level, String description) {
            riskFlags.add(new RiskFlag(level, description, null));
            return this;
        }

        public Builder theme(String... values) {
            themes.addAll(List.of(values));
            return this;
        }

        public Builder exploration(String... values) {
            explorations.addAll(List.of(values));
            return this;
        }

        public Builder question(String... values) {
            questions.addAll(List.of(values));
            return this;
        }

        public Builder confidence(double value) {
            this.confidence = value;
            return this;
        }

        public ClinicalAnalysis build() {
            return new ClinicalAnalysis(frameworks, patterns, riskFlags, themes, explorations, questions, confidence);
        }
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static <T> List<T> copy(List<T> list) {
        if (list == null || list.isEmpty()) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }
}
