package ru.aritmos.clinicalboundary.anonymization;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import ru.aritmos.clinicalboundary.core.BoundaryOutcome;

/**
 * Клиент по умолчанию, когда реальная интеграция с поисковым API не подключена.
 * <p>
 * Возвращает DISABLED, чтобы исследовательский слой оставался отключаемым без ошибок старта.
 */
@Singleton
@Secondary
public class NotConfiguredResearchClient implements ExternalResearchClient {

    @Override
    public String clientId() {
        return "not-configured";
    }

    @Override
    public BoundaryOutcome<AnonymizationModels.ResearchResponse> search(String anonymizedQuery) {
        return BoundaryOutcome.disabled("Исследовательский API не подключен");
    }
}
