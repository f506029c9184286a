package ru.aritmos.clinicalboundary.merge;

/**
 * Приёмник записей аудита попыток слияния (персистентный журнал, шина и т.п.).
 * <p>
 * Синхронная запись не обязательна, но вызов не должен молча теряться: исключение реализации
 * оркестратор логирует как ошибку.
 */
public interface MergeAuditSink {

    /**
     * @return идентификатор приёмника (для диагностики)
     */
    String id();

    void record(MergeModels.MergeAttemptRecord record);
}
