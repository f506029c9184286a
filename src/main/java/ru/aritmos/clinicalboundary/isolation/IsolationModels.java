package ru.aritmos.clinicalboundary.isolation;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Контракты изоляции для передачи данных партнёру.
 */
public final class IsolationModels {

    private IsolationModels() {
        // утилитарный класс
    }

    /**
     * Категория метки изолированного профиля.
     */
    public enum LabelCategory {
        ATTACHMENT("attachment_patterns"),
        FRAMEWORK("frameworks"),
        THEME("theme_categories"),
        MODALITY("modalities"),
        DEFENSE("defense_patterns"),
        COMMUNICATION("communication_patterns");

        private final String code;

        LabelCategory(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * Изолированный профиль одного партнёра.
     * <p>
     * В типе нет ни одного поля свободного текста: только метки из allow-list'ов.
     */
    @Schema(description = "Профиль партнёра: только метки из allow-list'ов, без свободного текста.")
    public record IsolatedProfile(
            List<String> attachmentPatterns,
            List<String> frameworks,
            List<String> themeCategories,
            List<String> modalities,
            List<String> defensePatterns,
            List<String> communicationPatterns
    ) {
        public IsolatedProfile {
            attachmentPatterns = copy(attachmentPatterns);
            frameworks = copy(frameworks);
            themeCategories = copy(themeCategories);
            modalities = copy(modalities);
            defensePatterns = copy(defensePatterns);
            communicationPatterns = copy(communicationPatterns);
        }

        public static IsolatedProfile empty() {
            return new IsolatedProfile(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        }

        static IsolatedProfile of(Map<LabelCategory, ? extends Set<String>> labels) {
            return new IsolatedProfile(
                    list(labels.get(LabelCategory.ATTACHMENT)),
                    list(labels.get(LabelCategory.FRAMEWORK)),
                    list(labels.get(LabelCategory.THEME)),
                    list(labels.get(LabelCategory.MODALITY)),
                    list(labels.get(LabelCategory.DEFENSE)),
                    list(labels.get(LabelCategory.COMMUNICATION)));
        }

        public List<String> labels(LabelCategory category) {
            return switch (category) {
                case ATTACHMENT -> attachmentPatterns;
                case FRAMEWORK -> frameworks;
                case THEME -> themeCategories;
                case MODALITY -> modalities;
                case DEFENSE -> defensePatterns;
                case COMMUNICATION -> communicationPatterns;
            };
        }

        /**
         * @return метки по категориям в фиксированном порядке
         */
        public Map<LabelCategory, List<String>> byCategory() {
            Map<LabelCategory, List<String>> out = new EnumMap<>(LabelCategory.class);
            for (LabelCategory c : LabelCategory.values()) {
                out.put(c, labels(c));
            }
            return out;
        }

        /**
         * @return все метки без повторов, в порядке категорий
         */
        public List<String> allLabels() {
            Set<String> all = new LinkedHashSet<>();
            for (LabelCategory c : LabelCategory.values()) {
                all.addAll(labels(c));
            }
            return new ArrayList<>(all);
        }

        public int size() {
            return byCategory().values().stream().mapToInt(List::size).sum();
        }

        private static List<String> list(Set<String> s) {
            return s == null ? List.of() : new ArrayList<>(s);
        }

        private static List<String> copy(List<String> l) {
            return l == null ? List.of() : List.copyOf(l);
        }
    }

    /**
     * Профиль и число отброшенных сырых меток (без их содержимого).
     */
    public record IsolationReport(IsolatedProfile profile, int droppedCount) {
    }

    /**
     * Результат независимой изоляции двух партнёров.
     */
    public record IsolatedPair(IsolationReport partnerA, IsolationReport partnerB) {

        public IsolatedProfile profileA() {
            return partnerA.profile();
        }

        public IsolatedProfile profileB() {
            return partnerB.profile();
        }
    }
}
