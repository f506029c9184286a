package ru.aritmos.clinicalboundary.merge;

import ru.aritmos.clinicalboundary.core.BoundaryException;

/**
 * Справочник связок пар: источник авторизации для слияния.
 * <p>
 * Реализация может обращаться к БД и блокировать поток; фильтры границы от неё не зависят.
 */
public interface CoupleLinkDirectory {

    /**
     * @param linkId идентификатор связки
     * @return связка
     * @throws CoupleLinkException NOT_FOUND/INVALID
     */
    CoupleLinkModels.CoupleLink getLink(String linkId);

    /**
     * Проверить, что терапевт владеет связкой и связка активна.
     *
     * @return {@code true}, если слияние разрешено
     * @throws CoupleLinkException NOT_FOUND/NOT_OWNED/NOT_ACTIVE
     */
    boolean validateMergeAuthorization(String linkId, String therapistId);

    /**
     * Отказ в доступе к связке пары.
     */
    final class CoupleLinkException extends BoundaryException {

        public enum Reason {
            NOT_FOUND,
            NOT_OWNED,
            NOT_ACTIVE,
            INVALID
        }

        private final Reason reason;

        public CoupleLinkException(Reason reason, String message) {
            super(Kind.AUTHORIZATION, "COUPLE_LINK_" + reason.name(), message);
            this.reason = reason;
        }

        public Reason reason() {
            return reason;
        }
    }
}
