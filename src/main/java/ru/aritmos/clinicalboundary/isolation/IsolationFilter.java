package ru.aritmos.clinicalboundary.isolation;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.core.BoundaryException;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Фильтр изоляции: полный анализ одного партнёра → профиль из меток allow-list'ов.
 * <p>
 * В отличие от абстракции, здесь работает allow-list: в профиль попадают только метки, явно
 * перечисленные в таблице соответствующей категории. Сырые метки без совпадений отбрасываются и
 * только подсчитываются.
 * <p>
 * Читаются лишь имена фреймворков, типы поведенческих паттернов и ключевые темы.
 * Свидетельства, индикаторы, контекст и флаги риска фильтр не читает.
 */
@Singleton
public class IsolationFilter {

    private static final Logger log = LoggerFactory.getLogger(IsolationFilter.class);

    private static final List<String> ATTACHMENT_STYLES = List.of("anxious", "avoidant", "secure", "disorganized");

    private static final String COMMUNICATION_CATEGORY = "communication";

    private static final Map<String, Pattern> PHRASE_PATTERNS = new ConcurrentHashMap<>();

    private final BoundaryTablesStore tablesStore;

    public IsolationFilter(BoundaryTablesStore tablesStore) {
        this.tablesStore = tablesStore;
    }

    /**
     * Изолированный профиль не прошёл повторную проверку. Слияние прерывается.
     */
    public static final class IsolationViolationException extends BoundaryException {

        public IsolationViolationException(String message) {
            super(Kind.CONTENT_SAFETY, "ISOLATION_VIOLATION", message);
        }
    }

    public IsolationModels.IsolatedProfile isolate(ClinicalModels.ClinicalAnalysis analysis) {
        return isolateWithReport(analysis).profile();
    }

    /**
     * Изолировать анализ и вернуть число отброшенных сырых меток.
     *
     * @param analysis анализ одного клиента
     * @return профиль + счётчик
     */
    public IsolationModels.IsolationReport isolateWithReport(ClinicalModels.ClinicalAnalysis analysis) {
        if (analysis == null) {
            return new IsolationModels.IsolationReport(IsolationModels.IsolatedProfile.empty(), 0);
        }
        BoundaryTables.IsolationSection iso = tablesStore.getEffective().isolation();

        Map<IsolationModels.LabelCategory, Set<String>> labels = new EnumMap<>(IsolationModels.LabelCategory.class);
        for (IsolationModels.LabelCategory c : IsolationModels.LabelCategory.values()) {
            labels.put(c, new LinkedHashSet<>());
        }
        int dropped = 0;

        for (ClinicalModels.FrameworkIdentification fw : analysis.frameworks()) {
            String name = fw.name();
            if (name == null || name.isBlank()) {
                continue;
            }
            boolean used = collect(name, iso.attachmentPatterns(), labels.get(IsolationModels.LabelCategory.ATTACHMENT));
            used |= collectAttachmentStyle(name, iso.attachmentPatterns(), labels.get(IsolationModels.LabelCategory.ATTACHMENT));
            used |= collect(name, iso.frameworks(), labels.get(IsolationModels.LabelCategory.FRAMEWORK));
            used |= collect(name, iso.modalities(), labels.get(IsolationModels.LabelCategory.MODALITY));
            if (COMMUNICATION_CATEGORY.equalsIgnoreCase(nullToEmpty(fw.category()).trim())) {
                used |= collect(name, iso.communicationPatterns(), labels.get(IsolationModels.LabelCategory.COMMUNICATION));
            }
            if (!used) {
                dropped++;
            }
        }

        for (ClinicalModels.BehavioralPattern p : analysis.behavioralPatterns()) {
            String type = p.type();
            if (type == null || type.isBlank()) {
                continue;
            }
            if (!collect(type, iso.defensePatterns(), labels.get(IsolationModels.LabelCategory.DEFENSE))) {
                dropped++;
            }
        }

        for (String theme : analysis.keyThemes()) {
            if (theme == null || theme.isBlank()) {
                continue;
            }
            boolean used = collect(theme, iso.themes(), labels.get(IsolationModels.LabelCategory.THEME));
            used |= collect(theme, iso.communicationPatterns(), labels.get(IsolationModels.LabelCategory.COMMUNICATION));
            if (!used) {
                dropped++;
            }
        }

        IsolationModels.IsolatedProfile profile = IsolationModels.IsolatedProfile.of(labels);
        if (dropped > 0) {
            log.debug("[ISOLATION] отброшено сырых меток вне allow-list: {}", dropped);
        }
        return new IsolationModels.IsolationReport(profile, dropped);
    }

    /**
     * Изолировать каждого партнёра независимо.
     * <p>
     * Каждый вызов {@link #isolateWithReport} видит анализ только одной стороны. В strict-режиме оба
     * профиля дополнительно проверяются {@link #verifyProfile}.
     *
     * @throws IsolationViolationException если профиль не прошёл проверку
     */
    public IsolationModels.IsolatedPair isolateForCouplesMerge(ClinicalModels.ClinicalAnalysis partnerA,
                                                              ClinicalModels.ClinicalAnalysis partnerB,
                                                              boolean strictMode) {
        IsolationModels.IsolationReport a = isolateWithReport(partnerA);
        IsolationModels.IsolationReport b = isolateWithReport(partnerB);
        if (strictMode) {
            verifyProfile(a.profile());
            verifyProfile(b.profile());
        }
        log.info("[ISOLATION] профили изолированы strict={} labelsA={} labelsB={} droppedA={} droppedB={}",
                strictMode, a.profile().size(), b.profile().size(), a.droppedCount(), b.droppedCount());
        return new IsolationModels.IsolatedPair(a, b);
    }

    /**
     * Повторная проверка профиля: членство каждой метки в allow-list'е своей категории и остаточный
     * сканер по шаблонам изоляции. Совпадение, которое само является разрешённой меткой, не считается нарушением.
     *
     * @throws IsolationViolationException при первом нарушении
     */
    public void verifyProfile(IsolationModels.IsolatedProfile profile) {
        BoundaryTables tables = tablesStore.getEffective();
        BoundaryTables.IsolationSection iso = tables.isolation();
        Set<String> allowed = tables.allowedLabels();

        for (Map.Entry<IsolationModels.LabelCategory, List<String>> e : profile.byCategory().entrySet()) {
            Set<String> categoryAllowList = lower(allowList(iso, e.getKey()));
            for (String label : e.getValue()) {
                String l = label.toLowerCase(Locale.ROOT);
                if (!categoryAllowList.contains(l)) {
                    log.warn("[ISOLATION] метка вне allow-list category={}", e.getKey().code());
                    throw new IsolationViolationException("Label outside allow-list in category " + e.getKey().code());
                }
                Optional<String> rule = tables.isolationResidual().firstResidualMatch(l, allowed::contains);
                if (rule.isPresent()) {
                    log.warn("[ISOLATION] остаточная проверка не пройдена category={} rule={}", e.getKey().code(), rule.get());
                    throw new IsolationViolationException("Residual content detected in category " + e.getKey().code());
                }
            }
        }
    }

    static List<String> allowList(BoundaryTables.IsolationSection iso, IsolationModels.LabelCategory category) {
        List<String> list = switch (category) {
            case ATTACHMENT -> iso.attachmentPatterns();
            case FRAMEWORK -> iso.frameworks();
            case THEME -> iso.themes();
            case MODALITY -> iso.modalities();
            case DEFENSE -> iso.defensePatterns();
            case COMMUNICATION -> iso.communicationPatterns();
        };
        return BoundaryTables.nullSafe(list);
    }

    /**
     * Найти все разрешённые термины, входящие в сырую метку целой фразой.
     * <p>
     * Длинные термины приоритетнее: короткий термин, целиком лежащий внутри уже найденного, не добавляется.
     *
     * @return {@code true}, если найден хотя бы один термин
     */
    static boolean collect(String raw, List<String> allowList, Set<String> sink) {
        if (allowList == null || allowList.isEmpty()) {
            return false;
        }
        String text = normalize(raw);
        List<String> terms = lower(allowList).stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .collect(Collectors.toList());

        List<int[]> consumed = new ArrayList<>();
        boolean found = false;
        for (String term : terms) {
            Matcher m = phrase(term).matcher(text);
            boolean hit = false;
            while (m.find()) {
                int start = m.start();
                int end = m.end();
                if (consumed.stream().noneMatch(s -> s[0] <= start && end <= s[1])) {
                    consumed.add(new int[]{start, end});
                    hit = true;
                }
            }
            if (hit) {
                sink.add(term);
                found = true;
            }
        }
        return found;
    }

    /**
     * Частичная форма: "attachment: anxious", "avoidant style of attachment" и т.п.
     */
    private static boolean collectAttachmentStyle(String raw, List<String> allowList, Set<String> sink) {
        String text = normalize(raw);
        if (!phrase("attachment").matcher(text).find()) {
            return false;
        }
        Set<String> allowed = lower(allowList);
        boolean found = false;
        for (String style : ATTACHMENT_STYLES) {
            String label = style + " attachment";
            if (allowed.contains(label) && phrase(style).matcher(text).find() && !sink.contains(label)) {
                sink.add(label);
                found = true;
            }
        }
        return found;
    }

    private static Pattern phrase(String term) {
        return PHRASE_PATTERNS.computeIfAbsent(term,
                t -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(t) + "(?![a-z0-9])"));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String normalize(String raw) {
        return raw.toLowerCase(Locale.ROOT).replace('_', ' ').trim();
    }

    private static Set<String> lower(List<String> values) {
        return BoundaryTables.nullSafe(values).stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
