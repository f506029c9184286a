package ru.aritmos.clinicalboundary.merge;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Приёмник "logging": пишет запись аудита в лог.
 * <p>
 * Используется, пока не подключено персистентное хранилище аудита.
 * В лог попадают идентификаторы, действие и счётчики меток, но не сами метки.
 */
@Singleton
@Secondary
public class LoggingMergeAuditSink implements MergeAuditSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingMergeAuditSink.class);

    @Override
    public String id() {
        return "logging";
    }

    @Override
    public void record(MergeModels.MergeAttemptRecord record) {
        if (record == null) {
            return;
        }
        int accessed = record.accessedLabels().values().stream()
                .flatMap(m -> m.values().stream())
                .mapToInt(List::size)
                .sum();
        log.info("[AUDIT][MERGE] id={} action={} kind={} stage={} coupleLinkId={} sessionId={} therapistId={} isolationInvoked={} accessedLabels={} ip={}",
                record.id(),
                record.action(),
                record.failureKind(),
                record.lastStage(),
                record.coupleLinkId(),
                record.sessionId(),
                record.therapistId(),
                record.isolationInvoked(),
                accessed,
                record.ipAddress());
    }
}
