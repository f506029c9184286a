package ru.aritmos.clinicalboundary;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа ядра клинической границы.
 * <p>
 * Ядро редуцирует клинический анализ одной стороны перед передачей трём потребителям: клиентскому
 * ассистенту, внешнему исследовательскому API и партнёру в паре. HTTP-слой и персистентность
 * подключаются снаружи через интерфейсы {@code CoupleLinkDirectory}, {@code MergeAuditSink} и
 * {@code ExternalResearchClient}.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
