package ru.aritmos.clinicalboundary.matching;

import jakarta.inject.Singleton;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.isolation.IsolationModels;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Сопоставление двух изолированных профилей: общие темы, взаимодополняющие и конфликтные паттерны.
 * <p>
 * Работает только с метками {@link IsolationModels.IsolatedProfile}. Поиск пар симметричен, пересечения
 * сортируются, поэтому перестановка аргументов не меняет ни одного списка.
 */
@Singleton
public class TopicMatcher {

    static final String ANXIOUS_AVOIDANT_TOPIC = "Anxious-Avoidant Dynamic";
    static final String FOUR_HORSEMEN_TOPIC = "Gottman Four Horsemen";
    static final int MAX_FOCUS_AREAS = 5;

    private final BoundaryTablesStore tablesStore;

    public TopicMatcher(BoundaryTablesStore tablesStore) {
        this.tablesStore = tablesStore;
    }

    public TopicMatchModels.TopicMatchResult match(IsolationModels.IsolatedProfile a, IsolationModels.IsolatedProfile b) {
        BoundaryTables.MatchingSection cfg = tablesStore.getEffective().matching();
        Set<String> positive = new LinkedHashSet<>(BoundaryTables.nullSafe(cfg.positiveOverlapThemes()));

        List<TopicMatchModels.TopicMatch> overlapping = overlap(a, b, positive);
        List<TopicMatchModels.TopicMatch> complementary = complementary(a, b, cfg);
        List<TopicMatchModels.TopicMatch> conflicts = conflicts(a, b, cfg);

        List<String> focus = focusAreas(a, b, positive, overlapping, complementary, conflicts);
        return new TopicMatchModels.TopicMatchResult(overlapping, complementary, conflicts, focus,
                summary(overlapping.size(), complementary.size(), conflicts.size()));
    }

    private static List<TopicMatchModels.TopicMatch> overlap(IsolationModels.IsolatedProfile a,
                                                            IsolationModels.IsolatedProfile b,
                                                            Set<String> positive) {
        List<TopicMatchModels.TopicMatch> out = new ArrayList<>();
        Set<String> emitted = new LinkedHashSet<>();

        for (String theme : intersect(a.themeCategories(), b.themeCategories())) {
            if (emitted.add(theme)) {
                out.add(new TopicMatchModels.TopicMatch(theme, TopicMatchModels.MatchType.OVERLAP,
                        positive.contains(theme) ? 0.9 : 0.7,
                        "Both partners working on " + theme, null));
            }
        }
        for (String p : intersect(a.attachmentPatterns(), b.attachmentPatterns())) {
            if (emitted.add(p)) {
                out.add(new TopicMatchModels.TopicMatch(p, TopicMatchModels.MatchType.OVERLAP, 0.85,
                        "Shared attachment pattern: " + p, null));
            }
        }
        for (String fw : intersect(a.frameworks(), b.frameworks())) {
            if (emitted.add(fw)) {
                out.add(new TopicMatchModels.TopicMatch(fw, TopicMatchModels.MatchType.OVERLAP, 0.9,
                        "Both working with " + fw + " framework", null));
            }
        }
        return out;
    }

    private static List<TopicMatchModels.TopicMatch> complementary(IsolationModels.IsolatedProfile a,
                                                                  IsolationModels.IsolatedProfile b,
                                                                  BoundaryTables.MatchingSection cfg) {
        Set<String> pa = patterns(a, true);
        Set<String> pb = patterns(b, true);

        List<TopicMatchModels.TopicMatch> out = new ArrayList<>();
        boolean anxiousAvoidantPairEmitted = false;
        String anxiousAvoidantFocus = null;
        for (BoundaryTables.PatternPair pair : BoundaryTables.nullSafe(cfg.complementaryPairs())) {
            boolean attachmentPair = isAnxiousAvoidantPair(pair, cfg);
            if (attachmentPair && anxiousAvoidantFocus == null) {
                anxiousAvoidantFocus = pair.focusArea();
            }
            if (pair.presentAcross(pa, pb)) {
                out.add(new TopicMatchModels.TopicMatch(pair.first() + " / " + pair.second(),
                        TopicMatchModels.MatchType.COMPLEMENTARY, 0.85, pair.description(), pair.focusArea()));
                anxiousAvoidantPairEmitted |= attachmentPair;
            }
        }

        boolean aAnxious = anyOf(pa, cfg.anxiousPatterns());
        boolean bAnxious = anyOf(pb, cfg.anxiousPatterns());
        boolean aAvoidant = anyOf(pa, cfg.avoidantPatterns());
        boolean bAvoidant = anyOf(pb, cfg.avoidantPatterns());
        if (((aAnxious && bAvoidant) || (bAnxious && aAvoidant)) && !anxiousAvoidantPairEmitted) {
            out.add(new TopicMatchModels.TopicMatch(ANXIOUS_AVOIDANT_TOPIC, TopicMatchModels.MatchType.COMPLEMENTARY, 0.9,
                    "Classic pursuer-distancer attachment pattern", anxiousAvoidantFocus));
        }
        return out;
    }

    private static List<TopicMatchModels.TopicMatch> conflicts(IsolationModels.IsolatedProfile a,
                                                              IsolationModels.IsolatedProfile b,
                                                              BoundaryTables.MatchingSection cfg) {
        Set<String> pa = patterns(a, false);
        Set<String> pb = patterns(b, false);

        List<TopicMatchModels.TopicMatch> out = new ArrayList<>();
        for (BoundaryTables.PatternPair pair : BoundaryTables.nullSafe(cfg.conflictPairs())) {
            if (pair.presentAcross(pa, pb)) {
                out.add(new TopicMatchModels.TopicMatch(pair.first() + " + " + pair.second(),
                        TopicMatchModels.MatchType.CONFLICT, 0.8, pair.description(), pair.focusArea()));
            }
        }

        Set<String> horsemen = new LinkedHashSet<>(BoundaryTables.nullSafe(cfg.fourHorsemen()));
        Set<String> ah = new TreeSet<>(pa);
        ah.retainAll(horsemen);
        Set<String> bh = new TreeSet<>(pb);
        bh.retainAll(horsemen);
        if (ah.size() >= 2 || bh.size() >= 2) {
            Set<String> combined = new TreeSet<>(ah);
            combined.addAll(bh);
            out.add(new TopicMatchModels.TopicMatch(FOUR_HORSEMEN_TOPIC, TopicMatchModels.MatchType.CONFLICT, 0.85,
                    "Negative patterns present: " + String.join(", ", combined), null));
        }
        return out;
    }

    /**
     * Порядок: общие позитивные темы, взаимодополняющие, конфликтные, оставшиеся позитивные темы пары.
     */
    private static List<String> focusAreas(IsolationModels.IsolatedProfile a,
                                           IsolationModels.IsolatedProfile b,
                                           Set<String> positive,
                                           List<TopicMatchModels.TopicMatch> overlapping,
                                           List<TopicMatchModels.TopicMatch> complementary,
                                           List<TopicMatchModels.TopicMatch> conflicts) {
        Set<String> focus = new LinkedHashSet<>();
        Set<String> sharedPositive = new LinkedHashSet<>();
        for (TopicMatchModels.TopicMatch m : overlapping) {
            if (positive.contains(m.topic())) {
                sharedPositive.add(m.topic());
                focus.add("Building shared " + m.topic());
            }
        }
        for (TopicMatchModels.TopicMatch m : complementary) {
            if (m.focusArea() != null) {
                focus.add(m.focusArea());
            }
        }
        for (TopicMatchModels.TopicMatch m : conflicts) {
            if (m.focusArea() != null) {
                focus.add(m.focusArea());
            }
        }
        Set<String> union = new TreeSet<>(a.themeCategories());
        union.addAll(b.themeCategories());
        for (String theme : union) {
            if (positive.contains(theme) && !sharedPositive.contains(theme)) {
                focus.add("Strengthening " + theme);
            }
        }
        List<String> out = new ArrayList<>(focus);
        return out.size() <= MAX_FOCUS_AREAS ? out : out.subList(0, MAX_FOCUS_AREAS);
    }

    static String summary(int overlapping, int complementary, int conflicts) {
        List<String> parts = new ArrayList<>();
        if (overlapping > 0) {
            parts.add(overlapping + " shared theme(s)");
        }
        if (complementary > 0) {
            parts.add(complementary + " complementary dynamic(s)");
        }
        if (conflicts > 0) {
            parts.add(conflicts + " potential conflict area(s)");
        }
        if (parts.isEmpty()) {
            return "No significant patterns identified between partners.";
        }
        return "Analysis identified: " + String.join(", ", parts) + ".";
    }

    private static Set<String> intersect(List<String> a, List<String> b) {
        Set<String> out = new TreeSet<>(a);
        out.retainAll(new LinkedHashSet<>(b));
        return out;
    }

    private static Set<String> patterns(IsolationModels.IsolatedProfile p, boolean withAttachment) {
        Set<String> out = new LinkedHashSet<>();
        if (withAttachment) {
            out.addAll(p.attachmentPatterns());
        }
        out.addAll(p.communicationPatterns());
        out.addAll(p.defensePatterns());
        return out;
    }

    private static boolean anyOf(Set<String> labels, List<String> candidates) {
        return BoundaryTables.nullSafe(candidates).stream().anyMatch(labels::contains);
    }

    private static boolean isAnxiousAvoidantPair(BoundaryTables.PatternPair pair, BoundaryTables.MatchingSection cfg) {
        List<String> anxious = BoundaryTables.nullSafe(cfg.anxiousPatterns());
        List<String> avoidant = BoundaryTables.nullSafe(cfg.avoidantPatterns());
        return (anxious.contains(pair.first()) && avoidant.contains(pair.second()))
                || (anxious.contains(pair.second()) && avoidant.contains(pair.first()));
    }
}
