package ru.aritmos.clinicalboundary.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import ru.aritmos.clinicalboundary.core.TermFilter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Статические таблицы клинической границы: словари терминов, allow-list'ы, паттерны, таблицы пар и упражнений.
 * <p>
 * Источник: версионируемый ресурс (по умолчанию {@code classpath:boundary/clinical-tables.json}),
 * который проходит клиническое/compliance-ревью как данные, а не как логика.
 * <p>
 * Важно:
 * <ul>
 *   <li>после {@link #compile(Definition)} объект неизменяем и безопасен для конкурентного чтения;</li>
 *   <li>таблицы никогда не приходят из пользовательского ввода.</li>
 * </ul>
 */
public final class BoundaryTables {

    /**
     * Сырое JSON-представление таблиц.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Definition(
            String revision,
            AbstractionSection abstraction,
            AnonymizationSection anonymization,
            IsolationSection isolation,
            MatchingSection matching,
            List<ExerciseGroup> exercises
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AbstractionSection(
            List<String> removeEntirely,
            Map<String, String> substitutions,
            Map<String, String> frameworkThemes,
            List<String> residualPatterns,
            String focusPrefix,
            String defaultFocus,
            Integer maxThemes,
            Integer maxExplorationAreas
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnonymizationSection(
            List<String> clinicalVocabulary,
            List<String> blockingPatterns,
            List<String> streetSuffixes,
            List<String> knownPlaces,
            List<CategorySection> categories,
            Map<String, String> queryTemplates
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CategorySection(String code, String placeholder, List<String> patterns) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IsolationSection(
            List<String> attachmentPatterns,
            List<String> frameworks,
            List<String> themes,
            List<String> defensePatterns,
            List<String> communicationPatterns,
            List<String> modalities,
            List<String> residualPatterns
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MatchingSection(
            List<String> positiveOverlapThemes,
            List<String> anxiousPatterns,
            List<String> avoidantPatterns,
            List<String> fourHorsemen,
            List<PatternPair> complementaryPairs,
            List<PatternPair> conflictPairs
    ) {
    }

    /**
     * Пара меток, которая образует известную динамику. Поиск симметричен.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternPair(String first, String second, String description, String focusArea) {

        public boolean presentAcross(Set<String> a, Set<String> b) {
            return (a.contains(first) && b.contains(second)) || (a.contains(second) && b.contains(first));
        }

        public boolean mentions(String label) {
            return first.equals(label) || second.equals(label);
        }
    }

    /**
     * Что активирует группу упражнений.
     */
    public enum ExerciseTrigger {
        /** Пара тревожный/избегающий тип привязанности у разных партнёров. */
        ATTACHMENT_PAIR,
        /** Категория темы присутствует хотя бы у одного партнёра. */
        THEME,
        /** Найден хотя бы один конфликтный паттерн. */
        CONFLICT
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExerciseGroup(String category, ExerciseTrigger trigger, List<String> items) {
    }

    /**
     * Скомпилированная категория PHI для анонимизатора.
     */
    public record PhiCategory(String code, String placeholder, List<Pattern> patterns) {
    }

    private final String revision;
    private final Definition definition;

    private final TermFilter abstractionFilter;
    private final TermFilter isolationResidual;
    private final List<Pattern> blockingPatterns;
    private final List<PhiCategory> phiCategories;
    private final Set<String> clinicalVocabulary;
    private final Set<String> streetSuffixes;
    private final Set<String> allowedLabels;

    private BoundaryTables(Definition d) {
        this.revision = d.revision() == null || d.revision().isBlank() ? "unversioned" : d.revision().trim();
        this.definition = d;

        AbstractionSection abs = d.abstraction();
        this.abstractionFilter = new TermFilter(abs.removeEntirely(), abs.substitutions(), abs.residualPatterns());

        IsolationSection iso = d.isolation();
        this.isolationResidual = new TermFilter(List.of(), Map.of(), iso.residualPatterns());

        AnonymizationSection an = d.anonymization();
        this.blockingPatterns = TermFilter.compileAll(an.blockingPatterns());
        this.phiCategories = nullSafe(an.categories()).stream()
                .map(c -> new PhiCategory(c.code(), c.placeholder() == null ? "[REDACTED]" : c.placeholder(),
                        TermFilter.compileAll(c.patterns())))
                .collect(Collectors.toUnmodifiableList());
        this.clinicalVocabulary = lowerSet(an.clinicalVocabulary());
        this.streetSuffixes = lowerSet(an.streetSuffixes());

        Set<String> all = new LinkedHashSet<>();
        all.addAll(lowerSet(iso.attachmentPatterns()));
        all.addAll(lowerSet(iso.frameworks()));
        all.addAll(lowerSet(iso.themes()));
        all.addAll(lowerSet(iso.defensePatterns()));
        all.addAll(lowerSet(iso.communicationPatterns()));
        all.addAll(lowerSet(iso.modalities()));
        this.allowedLabels = Set.copyOf(all);
    }

    /**
     * Проверить и скомпилировать таблицы.
     *
     * @param definition сырое представление
     * @return неизменяемые таблицы
     * @throws IllegalStateException если отсутствует обязательная секция
     */
    public static BoundaryTables compile(Definition definition) {
        if (definition == null) {
            throw new IllegalStateException("Таблицы клинической границы не заданы");
        }
        if (definition.abstraction() == null) {
            throw new IllegalStateException("В таблицах отсутствует секция abstraction");
        }
        if (definition.anonymization() == null) {
            throw new IllegalStateException("В таблицах отсутствует секция anonymization");
        }
        if (definition.isolation() == null) {
            throw new IllegalStateException("В таблицах отсутствует секция isolation");
        }
        if (definition.matching() == null) {
            throw new IllegalStateException("В таблицах отсутствует секция matching");
        }
        return new BoundaryTables(definition);
    }

    public String revision() {
        return revision;
    }

    public AbstractionSection abstraction() {
        return definition.abstraction();
    }

    public AnonymizationSection anonymization() {
        return definition.anonymization();
    }

    public IsolationSection isolation() {
        return definition.isolation();
    }

    public MatchingSection matching() {
        return definition.matching();
    }

    public List<ExerciseGroup> exercises() {
        return nullSafe(definition.exercises());
    }

    public TermFilter abstractionFilter() {
        return abstractionFilter;
    }

    public TermFilter isolationResidual() {
        return isolationResidual;
    }

    public List<Pattern> blockingPatterns() {
        return blockingPatterns;
    }

    public List<PhiCategory> phiCategories() {
        return phiCategories;
    }

    public Set<String> clinicalVocabulary() {
        return clinicalVocabulary;
    }

    public Set<String> streetSuffixes() {
        return streetSuffixes;
    }

    /**
     * @return объединение всех allow-list'ов изоляции (нижний регистр)
     */
    public Set<String> allowedLabels() {
        return allowedLabels;
    }

    public static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static Set<String> lowerSet(List<String> values) {
        return nullSafe(values).stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
