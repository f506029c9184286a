package ru.aritmos.clinicalboundary.anonymization;

import ru.aritmos.clinicalboundary.core.BoundaryOutcome;

/**
 * Клиент внешнего поискового/исследовательского API.
 * <p>
 * Реальные интеграции должны реализовывать этот интерфейс. Клиент никогда не получает запрос напрямую:
 * {@link ResearchService} передаёт ему только строку, для которой анонимизатор вернул {@code safe=true}.
 */
public interface ExternalResearchClient {

    /**
     * @return идентификатор клиента (для диагностики)
     */
    String clientId();

    /**
     * Выполнить поиск.
     *
     * @param anonymizedQuery уже анонимизированный запрос
     * @return ответ API или типизированный отказ
     */
    BoundaryOutcome<AnonymizationModels.ResearchResponse> search(String anonymizedQuery);
}
