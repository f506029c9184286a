package ru.aritmos.clinicalboundary.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Typed-конфигурация режимов клинической границы.
 * <p>
 * Читается из application.yml/ENV. Содержимое таблиц (термины, allow-list'ы) здесь не задаётся:
 * оно живёт в версионируемом ресурсе {@link BoundaryTablesStore}.
 */
@ConfigurationProperties("clinicalboundary")
public class BoundaryProperties {

    private Anonymization anonymization = new Anonymization();
    private Isolation isolation = new Isolation();
    private Audit audit = new Audit();

    public Anonymization getAnonymization() {
        return anonymization;
    }

    public void setAnonymization(Anonymization anonymization) {
        this.anonymization = anonymization == null ? new Anonymization() : anonymization;
    }

    public Isolation getIsolation() {
        return isolation;
    }

    public void setIsolation(Isolation isolation) {
        this.isolation = isolation == null ? new Isolation() : isolation;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit == null ? new Audit() : audit;
    }

    @ConfigurationProperties("anonymization")
    public static class Anonymization {
        /**
         * strict: любой найденный PHI отклоняет запрос; permissive: используется редактированный вариант.
         */
        private boolean strictMode = true;

        public boolean isStrictMode() {
            return strictMode;
        }

        public void setStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
        }
    }

    @ConfigurationProperties("isolation")
    public static class Isolation {
        private boolean strictMode = true;

        public boolean isStrictMode() {
            return strictMode;
        }

        public void setStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
        }
    }

    @ConfigurationProperties("audit")
    public static class Audit {
        private int inMemoryCapacity = 1000;

        public int getInMemoryCapacity() {
            return inMemoryCapacity;
        }

        public void setInMemoryCapacity(int inMemoryCapacity) {
            this.inMemoryCapacity = Math.max(1, inMemoryCapacity);
        }
    }
}
