package ru.aritmos.clinicalboundary.core;

/**
 * Базовое исключение клинической границы.
 * <p>
 * Каждое исключение несёт {@link Kind}, чтобы журнал аудита и логи различали:
 * <ul>
 *   <li>срабатывание фильтра безопасности контента (возможный «near-miss», требует compliance-ревью);</li>
 *   <li>обычный отказ в доступе (связка не найдена, чужой терапевт, связка не активна);</li>
 *   <li>прочие сбои оркестрации.</li>
 * </ul>
 * <p>
 * Важно: {@link #getMessage()} предназначен только для терапевтических/аудиторских представлений.
 * Клиентскому ассистенту отдаётся исключительно {@link #safeMessage()}.
 */
public abstract class BoundaryException extends RuntimeException {

    /**
     * Обобщённый текст для клиентских потребителей. Не раскрывает ни сработавший паттерн, ни удалённый термин.
     */
    public static final String CLIENT_SAFE_MESSAGE = "Could not complete this step safely.";

    /**
     * Класс отказа.
     */
    public enum Kind {
        /** Результат вычислен, но не прошёл проверку безопасности. */
        CONTENT_SAFETY,
        /** Отказ в доступе (связка пары/терапевт/статус). */
        AUTHORIZATION,
        /** Иной сбой на этапах match/derive/build. */
        ORCHESTRATION
    }

    private final Kind kind;
    private final String errorCode;

    protected BoundaryException(Kind kind, String errorCode, String message) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    protected BoundaryException(Kind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    public Kind kind() {
        return kind;
    }

    public String errorCode() {
        return errorCode;
    }

    /**
     * @return сообщение, допустимое для клиентского ассистента
     */
    public String safeMessage() {
        return CLIENT_SAFE_MESSAGE;
    }
}
