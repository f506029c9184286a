package ru.aritmos.clinicalboundary.abstraction;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.core.BoundaryException;
import ru.aritmos.clinicalboundary.core.BoundaryOutcome;
import ru.aritmos.clinicalboundary.core.TermFilter;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Фильтр абстракции: полный клинический анализ → гайд для клиентского ассистента.
 * <p>
 * Клиентский ассистент НИКОГДА не получает сырой анализ. Алгоритм:
 * <ol>
 *   <li>элемент с термином из словаря полного удаления отбрасывается целиком;</li>
 *   <li>клинические термины заменяются на бытовой язык;</li>
 *   <li>элемент, в котором после замены осталась клиническая лексика, отбрасывается целиком;</li>
 *   <li>первая буква делается заглавной;</li>
 *   <li>темы ограничены 5, направления: 4;</li>
 *   <li>фокус строится из первой уцелевшей темы;</li>
 *   <li>независимая остаточная проверка всего результата; любое совпадение → {@code safe=false}.</li>
 * </ol>
 * Флаги риска, свидетельства и цитаты через границу не проходят вовсе.
 * <p>
 * Фильтр не имеет изменяемого состояния: результат зависит только от входа и таблиц.
 */
@Singleton
public class AbstractionFilter {

    private static final Logger log = LoggerFactory.getLogger(AbstractionFilter.class);

    private final BoundaryTablesStore tablesStore;

    public AbstractionFilter(BoundaryTablesStore tablesStore) {
        this.tablesStore = tablesStore;
    }

    /**
     * Исключение: абстрагированный результат не прошёл остаточную проверку.
     */
    public static final class AbstractionException extends BoundaryException {

        public AbstractionException(String message) {
            super(Kind.CONTENT_SAFETY, "ABSTRACTION_UNSAFE", message);
        }
    }

    /**
     * Абстрагировать анализ.
     *
     * @param analysis полный анализ
     * @return гайд + список удалённых терминов + признак безопасности
     */
    public AbstractionModels.AbstractionResult abstractAnalysis(ClinicalModels.ClinicalAnalysis analysis) {
        BoundaryTables tables = tablesStore.getEffective();
        BoundaryTables.AbstractionSection cfg = tables.abstraction();
        TermFilter filter = tables.abstractionFilter();

        Set<String> stripped = new LinkedHashSet<>();

        List<String> themes = transformAll(analysis.keyThemes(), filter, stripped);
        for (ClinicalModels.FrameworkIdentification fw : analysis.frameworks()) {
            String category = fw.category() == null ? "" : fw.category().toLowerCase(Locale.ROOT).trim();
            String generic = frameworkTheme(cfg.frameworkThemes(), category);
            if (generic != null && filter.firstResidualFragment(generic).isEmpty()) {
                String capitalized = TermFilter.capitalize(generic);
                if (!themes.contains(capitalized)) {
                    themes.add(capitalized);
                }
            }
        }
        themes = limit(themes, cfg.maxThemes(), 5);

        List<String> explorations = limit(transformAll(analysis.suggestedExplorations(), filter, stripped),
                cfg.maxExplorationAreas(), 4);

        String focus = themes.isEmpty()
                ? cfg.defaultFocus()
                : cfg.focusPrefix() + filter.substitute(themes.get(0), null);

        AbstractionModels.ClientSafeGuide guide = new AbstractionModels.ClientSafeGuide(themes, explorations, focus);
        Optional<String> residual = filter.firstResidualMatch(guide.concatenated());
        if (residual.isPresent()) {
            log.warn("[ABSTRACTION] остаточная проверка не пройдена rule={} themes={} explorations={}",
                    residual.get(), themes.size(), explorations.size());
        }

        return new AbstractionModels.AbstractionResult(
                guide,
                new ArrayList<>(stripped),
                analysis.riskFlags().size(),
                residual.isEmpty());
    }

    /**
     * Повторная независимая проверка уже построенного гайда.
     *
     * @param guide гайд
     * @return {@code true}, если гайд не содержит остаточной клинической лексики
     */
    public boolean verify(AbstractionModels.ClientSafeGuide guide) {
        if (guide == null) {
            return false;
        }
        return !tablesStore.getEffective().abstractionFilter().containsResidual(guide.concatenated());
    }

    /**
     * Построить вход клиентского ассистента.
     * <p>
     * Частично очищенный гайд не возвращается никогда: при {@code safe=false} вызывающий пайплайн
     * должен прервать текущий прогон.
     *
     * @throws AbstractionException если результат абстракции небезопасен
     */
    public AbstractionModels.ClientSessionInput toClientInput(ClinicalModels.ClinicalAnalysis analysis,
                                                              Integer sessionNumber,
                                                              String clientFirstName) {
        AbstractionModels.AbstractionResult result = abstractAnalysis(analysis);
        if (!result.safe() || !verify(result.guide())) {
            throw new AbstractionException("Абстрагированный результат содержит клиническую терминологию");
        }
        AbstractionModels.ClientSafeGuide g = result.guide();
        return new AbstractionModels.ClientSessionInput(
                g.themes(), g.explorationAreas(), g.sessionFocus(), sessionNumber, clientFirstName);
    }

    /**
     * Вариант {@link #toClientInput} без исключений.
     */
    public BoundaryOutcome<AbstractionModels.ClientSessionInput> tryClientInput(ClinicalModels.ClinicalAnalysis analysis,
                                                                                Integer sessionNumber,
                                                                                String clientFirstName) {
        try {
            AbstractionModels.ClientSessionInput in = toClientInput(analysis, sessionNumber, clientFirstName);
            return BoundaryOutcome.ok(in, Map.of("themes", in.themes().size()));
        } catch (AbstractionException e) {
            return BoundaryOutcome.rejected(e);
        }
    }

    private List<String> transformAll(List<String> items, TermFilter filter, Set<String> stripped) {
        List<String> out = new ArrayList<>();
        int dropped = 0;
        for (String item : items) {
            if (item == null || item.isBlank()) {
                continue;
            }
            Optional<String> removal = filter.firstRemovalTerm(item);
            if (removal.isPresent()) {
                stripped.add(removal.get());
                continue;
            }
            String transformed = TermFilter.capitalize(filter.substitute(item.trim(), stripped));
            if (transformed.isBlank()) {
                continue;
            }
            Optional<String> residual = filter.firstResidualFragment(transformed);
            if (residual.isPresent()) {
                stripped.add(residual.get());
                dropped++;
                continue;
            }
            out.add(transformed);
        }
        if (dropped > 0) {
            log.debug("[ABSTRACTION] отброшено элементов с остаточной клинической лексикой: {}", dropped);
        }
        return out;
    }

    private static String frameworkTheme(Map<String, String> frameworkThemes, String category) {
        if (frameworkThemes == null || category.isEmpty()) {
            return null;
        }
        return frameworkThemes.get(category);
    }

    private static List<String> limit(List<String> items, Integer configured, int fallback) {
        int max = configured == null || configured <= 0 ? fallback : configured;
        return items.size() <= max ? items : new ArrayList<>(items.subList(0, max));
    }
}
