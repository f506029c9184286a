package ru.aritmos.clinicalboundary.core;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Универсальный исход операции на клинической границе.
 * <p>
 * Нужен для вызывающих сторон, которые не хотят строить логику на исключениях:
 * небезопасный случай приходит как типизированный статус, и его невозможно «не заметить»,
 * т.к. {@link #result()} заполнен только при {@code success=true}.
 */
@Schema(description = "Результат операции фильтра (OK/REJECTED/DISABLED/ERROR) + данные + диагностика без контента.")
public record BoundaryOutcome<T>(
        @Schema(description = "Флаг успеха. true означает, что result безопасен для передачи через границу.")
        boolean success,
        @Schema(description = "Код исхода (OK/REJECTED/DISABLED/ERROR).")
        String outcome,
        @Schema(description = "Код ошибки (если есть).")
        String errorCode,
        @Schema(description = "Сообщение об ошибке (без клинического контента).")
        String message,
        @Schema(description = "Результат операции (если success=true).")
        T result,
        @Schema(description = "Дополнительная диагностика (счётчики, категории, без контента).")
        Map<String, Object> details
) {
    public static <T> BoundaryOutcome<T> ok(T result, Map<String, Object> details) {
        return new BoundaryOutcome<>(true, "OK", null, null, result, details == null ? Map.of() : details);
    }

    public static <T> BoundaryOutcome<T> rejected(BoundaryException e) {
        return new BoundaryOutcome<>(false, "REJECTED", e.errorCode(), e.safeMessage(), null,
                Map.of("kind", e.kind().name()));
    }

    public static <T> BoundaryOutcome<T> disabled(String message) {
        return new BoundaryOutcome<>(false, "DISABLED", "BOUNDARY_DISABLED", message, null, Map.of());
    }

    public static <T> BoundaryOutcome<T> error(String code, String message, Map<String, Object> details) {
        return new BoundaryOutcome<>(false, "ERROR", code, message, null, details == null ? Map.of() : details);
    }
}
