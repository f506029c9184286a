package ru.aritmos.clinicalboundary.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Движок «преобразовать или отвергнуть» поверх подстрочных словарей и регулярных выражений.
 * <p>
 * Используется фильтрами абстракции (клиентский ассистент) и изоляции (партнёр):
 * <ul>
 *   <li>словарь полного удаления: любое вхождение отбрасывает элемент целиком;</li>
 *   <li>карта замен клинический термин → бытовой язык (длинные термины приоритетнее, один проход);</li>
 *   <li>независимая остаточная проверка набором регулярных выражений.</li>
 * </ul>
 * <p>
 * Экземпляр неизменяем и потокобезопасен.
 */
public final class TermFilter {

    private final List<String> removalTerms;
    private final Map<String, String> substitutions;
    private final Pattern substitutionPattern;
    private final List<Pattern> residualPatterns;

    public TermFilter(Collection<String> removalTerms,
                      Map<String, String> substitutions,
                      Collection<String> residualPatterns) {
        this.removalTerms = normalizeTerms(removalTerms);

        Map<String, String> subs = new LinkedHashMap<>();
        if (substitutions != null) {
            substitutions.forEach((k, v) -> {
                if (k != null && !k.isBlank()) {
                    subs.put(k.toLowerCase(Locale.ROOT).trim(), v == null ? "" : v);
                }
            });
        }
        this.substitutions = Map.copyOf(subs);
        this.substitutionPattern = subs.isEmpty() ? null : Pattern.compile(
                subs.keySet().stream()
                        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                        .map(Pattern::quote)
                        .collect(Collectors.joining("|", "(", ")")));
        this.residualPatterns = compileAll(residualPatterns);
    }

    /**
     * Скомпилировать регулярные выражения без учёта регистра.
     * <p>
     * Отдельный паттерн может вернуть чувствительность к регистру встроенным флагом {@code (?-i)}.
     *
     * @param sources исходные выражения
     * @return неизменяемый список
     */
    public static List<Pattern> compileAll(Collection<String> sources) {
        if (sources == null || sources.isEmpty()) {
            return List.of();
        }
        List<Pattern> out = new ArrayList<>(sources.size());
        for (String s : sources) {
            if (s != null && !s.isBlank()) {
                out.add(Pattern.compile(s, Pattern.CASE_INSENSITIVE));
            }
        }
        return List.copyOf(out);
    }

    /**
     * Найти первый термин из словаря полного удаления.
     *
     * @param text проверяемый текст
     * @return найденный термин (в нижнем регистре)
     */
    public Optional<String> firstRemovalTerm(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String term : removalTerms) {
            if (lower.contains(term)) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }

    /**
     * Заменить клинические термины на бытовой язык.
     * <p>
     * Текст приводится к нижнему регистру; заменённый текст повторно не сканируется.
     *
     * @param text исходный текст
     * @param strippedSink сюда добавляется каждый заменённый термин (ключ карты)
     * @return преобразованный текст в нижнем регистре
     */
    public String substitute(String text, Collection<String> strippedSink) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (substitutionPattern == null) {
            return lower;
        }
        Matcher m = substitutionPattern.matcher(lower);
        StringBuilder sb = new StringBuilder(lower.length());
        while (m.find()) {
            String term = m.group(1);
            if (strippedSink != null) {
                strippedSink.add(term);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(substitutions.get(term)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Остаточная проверка: словарь удаления и регулярные выражения.
     *
     * @param text проверяемый текст
     * @return описание сработавшего правила (сам найденный фрагмент не возвращается)
     */
    public Optional<String> firstResidualMatch(String text) {
        return firstResidualMatch(text, m -> false);
    }

    /**
     * Остаточная проверка с исключениями.
     *
     * @param text проверяемый текст
     * @param exempt предикат над найденным фрагментом; {@code true} означает «разрешено»
     * @return описание сработавшего правила
     */
    public Optional<String> firstResidualMatch(String text, Predicate<String> exempt) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> removal = firstRemovalTerm(text);
        if (removal.isPresent()) {
            return Optional.of("removal-vocabulary");
        }
        for (Pattern p : residualPatterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String found = m.group().toLowerCase(Locale.ROOT);
                if (!exempt.test(found)) {
                    return Optional.of(p.pattern());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Фрагмент текста, на котором срабатывает остаточная проверка.
     * <p>
     * Совпадение регулярного выражения расширяется до границ слова: {@code \bdiagnos} в
     * "diagnostic clarity" даёт "diagnostic". Используется для учёта удалённых терминов, в логи не пишется.
     *
     * @param text проверяемый текст
     * @return найденный термин удаления или слово в нижнем регистре
     */
    public Optional<String> firstResidualFragment(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> removal = firstRemovalTerm(text);
        if (removal.isPresent()) {
            return removal;
        }
        for (Pattern p : residualPatterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                int start = m.start();
                int end = m.end();
                while (start > 0 && Character.isLetterOrDigit(text.charAt(start - 1))) {
                    start--;
                }
                while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
                    end++;
                }
                return Optional.of(text.substring(start, end).toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    public boolean containsResidual(String text) {
        return firstResidualMatch(text).isPresent();
    }

    /**
     * @return число терминов в карте замен
     */
    public int substitutionCount() {
        return substitutions.size();
    }

    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static List<String> normalizeTerms(Collection<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        return terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT).trim())
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }
}
