package ru.aritmos.clinicalboundary.anonymization;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.config.BoundaryProperties;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.core.BoundaryException;
import ru.aritmos.clinicalboundary.core.BoundaryOutcome;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Анонимизатор запросов к внешнему поисковому API.
 * <p>
 * Порядок обработки:
 * <ol>
 *   <li>блокирующие паттерны явного самораскрытия ("my name is", "I live at") сразу дают {@code safe=false}
 *       с пустым кандидатом, частичная редакция не выполняется;</li>
 *   <li>эвристика имён: пары соседних слов с заглавной буквы, кроме клинической лексики, улиц и известных мест;</li>
 *   <li>наборы регулярных выражений по категориям с отбрасыванием ложных срабатываний на клинической лексике;</li>
 *   <li>в strict-режиме любая найденная категория отклоняет запрос.</li>
 * </ol>
 * В логи попадают только категории и длина запроса, но не сам текст.
 */
@Singleton
public class QueryAnonymizer {

    private static final Logger log = LoggerFactory.getLogger(QueryAnonymizer.class);

    private static final Pattern CAPITALIZED_RUN = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+\\b");
    private static final Pattern CAPITALIZED_WORD = Pattern.compile("[A-Z][a-z]+");
    private static final String PERSON_PLACEHOLDER = "[PERSON]";
    private static final String NAME_CATEGORY = "name";

    private final BoundaryTablesStore tablesStore;
    private final BoundaryProperties properties;

    public QueryAnonymizer(BoundaryTablesStore tablesStore, BoundaryProperties properties) {
        this.tablesStore = tablesStore;
        this.properties = properties;
    }

    /**
     * Запрос нельзя безопасно передать во внешний API.
     */
    public static final class AnonymizationException extends BoundaryException {

        public AnonymizationException(String message) {
            super(Kind.CONTENT_SAFETY, "ANONYMIZATION_REJECTED", message);
        }
    }

    public boolean isStrictMode() {
        return properties == null || properties.getAnonymization().isStrictMode();
    }

    /**
     * Анонимизировать запрос.
     *
     * @param query исходный запрос
     * @return исход с кандидатом, категориями и признаком безопасности
     */
    public AnonymizationModels.AnonymizationOutcome anonymize(String query) {
        if (query == null || query.isBlank()) {
            return new AnonymizationModels.AnonymizationOutcome(query, "", List.of(), false, "Empty query");
        }
        BoundaryTables tables = tablesStore.getEffective();

        for (Pattern p : tables.blockingPatterns()) {
            if (p.matcher(query).find()) {
                log.warn("[ANONYMIZER] запрос заблокирован: явное самораскрытие length={}", query.length());
                return new AnonymizationModels.AnonymizationOutcome(query, "",
                        List.of(AnonymizationModels.BLOCKING_CATEGORY), false,
                        "Query contains explicit PHI disclosure patterns");
            }
        }

        Set<String> categories = new LinkedHashSet<>();
        String redacted = redactNames(query, tables, categories);

        for (BoundaryTables.PhiCategory category : tables.phiCategories()) {
            for (Pattern p : category.patterns()) {
                redacted = redactCategory(redacted, p, category, tables.clinicalVocabulary(), categories);
            }
        }

        List<String> found = new ArrayList<>(categories);
        if (!found.isEmpty() && isStrictMode()) {
            log.warn("[ANONYMIZER] запрос отклонён categories={} length={}", found, query.length());
            return new AnonymizationModels.AnonymizationOutcome(query, redacted, found, false,
                    "PHI detected: " + String.join(", ", found));
        }
        if (!found.isEmpty()) {
            log.info("[ANONYMIZER] запрос отредактирован (permissive) categories={} length={}", found, query.length());
        }
        return new AnonymizationModels.AnonymizationOutcome(query, redacted, found, true, null);
    }

    /**
     * @return {@code true}, если запрос можно передать во внешний API
     */
    public boolean isSafe(String query) {
        return anonymize(query).safe();
    }

    /**
     * Проверить и вернуть анонимизированный запрос.
     *
     * @throws AnonymizationException если запрос небезопасен
     */
    public String validateAndAnonymize(String query) {
        AnonymizationModels.AnonymizationOutcome r = anonymize(query);
        if (!r.safe()) {
            throw new AnonymizationException("Query rejected: " + r.rejectionReason());
        }
        return r.anonymizedQuery();
    }

    /**
     * Вариант {@link #validateAndAnonymize(String)} без исключений.
     */
    public BoundaryOutcome<String> tryValidate(String query) {
        AnonymizationModels.AnonymizationOutcome r = anonymize(query);
        if (!r.safe()) {
            return BoundaryOutcome.rejected(new AnonymizationException("Query rejected: " + r.rejectionReason()));
        }
        return BoundaryOutcome.ok(r.anonymizedQuery(), Map.of("categories", r.categories()));
    }

    /**
     * Эвристика имён по цепочкам слов с заглавной буквы.
     * <p>
     * Каждая соседняя пара цепочки проверяется отдельно, поэтому в "Therapy John Smith" пара
     * "John Smith" не теряется из-за пары "Therapy John". Слово из клинической лексики остаётся на месте,
     * подряд идущие слова-имена сворачиваются в один {@code [PERSON]}.
     */
    private String redactNames(String text, BoundaryTables tables, Set<String> categories) {
        Matcher m = CAPITALIZED_RUN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            String run = m.group();
            String redacted = redactRun(run, tables);
            if (!redacted.equals(run)) {
                categories.add(NAME_CATEGORY);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(redacted));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String redactRun(String run, BoundaryTables tables) {
        Set<String> vocabulary = tables.clinicalVocabulary();
        List<String> knownPlaces = BoundaryTables.nullSafe(tables.anonymization().knownPlaces());

        List<int[]> words = new ArrayList<>();
        Matcher w = CAPITALIZED_WORD.matcher(run);
        while (w.find()) {
            words.add(new int[]{w.start(), w.end()});
        }

        boolean[] person = new boolean[words.size()];
        for (int i = 0; i + 1 < words.size(); i++) {
            int[] a = words.get(i);
            int[] b = words.get(i + 1);
            String first = run.substring(a[0], a[1]).toLowerCase(Locale.ROOT);
            String second = run.substring(b[0], b[1]).toLowerCase(Locale.ROOT);
            boolean skip = (vocabulary.contains(first) && vocabulary.contains(second))
                    || tables.streetSuffixes().contains(second)
                    || knownPlaces.contains(run.substring(a[0], b[1]));
            if (!skip) {
                person[i] |= !vocabulary.contains(first);
                person[i + 1] |= !vocabulary.contains(second);
            }
        }

        StringBuilder out = new StringBuilder(run.length());
        int pos = 0;
        boolean inPerson = false;
        for (int i = 0; i < words.size(); i++) {
            int[] span = words.get(i);
            if (person[i]) {
                if (!inPerson) {
                    out.append(run, pos, span[0]).append(PERSON_PLACEHOLDER);
                    inPerson = true;
                }
            } else {
                out.append(run, pos, span[1]);
                inPerson = false;
            }
            pos = span[1];
        }
        out.append(run.substring(pos));
        return out.toString();
    }

    private static String redactCategory(String text,
                                         Pattern pattern,
                                         BoundaryTables.PhiCategory category,
                                         Set<String> vocabulary,
                                         Set<String> categories) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            if (isClinicalVocabulary(m.group(), vocabulary)) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            } else {
                categories.add(category.code());
                m.appendReplacement(sb, Matcher.quoteReplacement(category.placeholder()));
            }
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Ложное срабатывание: каждое слово совпадения входит в клиническую лексику.
     */
    static boolean isClinicalVocabulary(String match, Set<String> vocabulary) {
        String[] words = match.trim().split("\\s+");
        if (words.length == 0) {
            return false;
        }
        for (String w : words) {
            String word = w.replaceAll("^\\p{Punct}+|\\p{Punct}+$", "").toLowerCase(Locale.ROOT);
            if (word.isEmpty() || !vocabulary.contains(word)) {
                return false;
            }
        }
        return true;
    }
}
