package ru.aritmos.clinicalboundary.merge;

import io.swagger.v3.oas.annotations.media.Schema;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Контракты слияния профилей пары и журнала попыток слияния.
 */
public final class MergeModels {

    private MergeModels() {
        // утилитарный класс
    }

    public static final String EVENT_TYPE = "couples_merge";

    /**
     * Запрос слияния.
     * <p>
     * Принимает только сырые анализы партнёров: изоляцию всегда выполняет оркестратор,
     * заранее изолированный профиль передать нельзя.
     */
    public record MergeRequest(
            String coupleLinkId,
            String sessionId,
            String therapistId,
            ClinicalModels.ClinicalAnalysis partnerAAnalysis,
            ClinicalModels.ClinicalAnalysis partnerBAnalysis,
            String ipAddress
    ) {
        public MergeRequest {
            Objects.requireNonNull(partnerAAnalysis, "partnerAAnalysis");
            Objects.requireNonNull(partnerBAnalysis, "partnerBAnalysis");
            ipAddress = ipAddress == null || ipAddress.isBlank() ? "unknown" : ipAddress;
        }
    }

    @Schema(description = "Результат слияния: только метки, темы и упражнения.")
    public record MergedOutcome(
            String id,
            String coupleLinkId,
            String sessionId,
            List<String> partnerALabels,
            List<String> partnerBLabels,
            List<String> overlapping,
            List<String> complementary,
            List<String> conflicts,
            List<String> focusAreas,
            @Schema(description = "Упражнения для пары (не более 6, без повторов).")
            List<String> exercises,
            String summary,
            Instant createdAt
    ) {
        public MergedOutcome {
            partnerALabels = copy(partnerALabels);
            partnerBLabels = copy(partnerBLabels);
            overlapping = copy(overlapping);
            complementary = copy(complementary);
            conflicts = copy(conflicts);
            focusAreas = copy(focusAreas);
            exercises = copy(exercises);
        }
    }

    /**
     * Итог попытки слияния в журнале.
     */
    public enum MergeAction {
        /** Слияние выполнено. */
        MERGE_COMPLETED,
        /** Отказ авторизации (связка не найдена/чужая/не активна). */
        MERGE_DENIED,
        /** Сработала проверка безопасности контента. */
        MERGE_BLOCKED,
        /** Иной сбой оркестрации. */
        MERGE_FAILED
    }

    public enum MergeStage {
        AUTHORIZE,
        ISOLATE,
        MATCH,
        DERIVE_EXERCISES,
        BUILD_OUTCOME,
        AUDIT
    }

    @Schema(description = "Запись аудита попытки слияния. Ровно одна на каждый вызов merge().")
    public record MergeAttemptRecord(
            String id,
            String eventType,
            String coupleLinkId,
            String sessionId,
            String therapistId,
            String partnerAId,
            String partnerBId,
            MergeAction action,
            @Schema(description = "Класс отказа (CONTENT_SAFETY/AUTHORIZATION/ORCHESTRATION) или null при успехе.")
            String failureKind,
            @Schema(description = "Последний начатый этап конвейера.")
            MergeStage lastStage,
            @Schema(description = "Изоляция вызывается безусловно; поле всегда true.")
            boolean isolationInvoked,
            @Schema(description = "Снимок меток, к которым был доступ (по партнёрам и категориям).")
            Map<String, Map<String, List<String>>> accessedLabels,
            String resultSummary,
            @Schema(description = "Санитизированное сообщение об ошибке.")
            String errorMessage,
            String ipAddress,
            Instant createdAt
    ) {
        public MergeAttemptRecord {
            accessedLabels = snapshot(accessedLabels);
        }

        public boolean succeeded() {
            return action == MergeAction.MERGE_COMPLETED;
        }
    }

    /**
     * Глубокая неизменяемая копия снимка меток с сохранением порядка партнёров и категорий.
     */
    private static Map<String, Map<String, List<String>>> snapshot(Map<String, Map<String, List<String>>> labels) {
        if (labels == null || labels.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, List<String>>> out = new LinkedHashMap<>();
        labels.forEach((partner, byCategory) -> {
            Map<String, List<String>> inner = new LinkedHashMap<>();
            if (byCategory != null) {
                byCategory.forEach((category, values) -> inner.put(category, copy(values)));
            }
            out.put(partner, Collections.unmodifiableMap(inner));
        });
        return Collections.unmodifiableMap(out);
    }

    private static List<String> copy(List<String> l) {
        return l == null ? List.of() : List.copyOf(l);
    }
}
