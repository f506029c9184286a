package ru.aritmos.clinicalboundary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Value;
import io.micronaut.core.io.ResourceResolver;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Хранилище статических таблиц клинической границы.
 * <p>
 * Таблицы загружаются из версионируемого ресурса один раз при старте и далее только читаются.
 * Повторная загрузка ({@link #reload()}) атомарно заменяет ссылку на новый неизменяемый набор;
 * фильтры, уже получившие предыдущий набор, дорабатывают на нём.
 * <p>
 * Важно: в отличие от runtime-конфигурации, ошибка загрузки таблиц фатальна. Без таблиц
 * фильтры не могут гарантировать ни одного отрицательного свойства, поэтому fallback на «пустые»
 * таблицы запрещён (fail-closed).
 */
@Singleton
public class BoundaryTablesStore {

    private static final Logger log = LoggerFactory.getLogger(BoundaryTablesStore.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ResourceResolver resourceResolver;
    private final ObjectMapper objectMapper;
    private final String tablesPath;

    private final AtomicReference<BoundaryTables> effective = new AtomicReference<>();

    public BoundaryTablesStore(ResourceResolver resourceResolver,
                               ObjectMapper objectMapper,
                               @Value("${clinicalboundary.tables.path:classpath:boundary/clinical-tables.json}") String tablesPath) {
        this.resourceResolver = resourceResolver;
        this.objectMapper = objectMapper;
        this.tablesPath = tablesPath;
    }

    @PostConstruct
    void init() {
        effective.set(load());
    }

    /**
     * @return актуальные таблицы (загружаются при первом обращении, если init ещё не выполнялся)
     */
    public BoundaryTables getEffective() {
        BoundaryTables t = effective.get();
        if (t == null) {
            effective.compareAndSet(null, load());
            t = effective.get();
        }
        return t;
    }

    /**
     * Перечитать таблицы из ресурса.
     *
     * @return новая ревизия
     */
    public String reload() {
        BoundaryTables t = load();
        effective.set(t);
        return t.revision();
    }

    private BoundaryTables load() {
        try (InputStream in = open(tablesPath).orElseThrow(
                () -> new IllegalStateException("Не найден ресурс таблиц клинической границы: " + tablesPath))) {
            BoundaryTables.Definition def = objectMapper.readValue(in, BoundaryTables.Definition.class);
            BoundaryTables tables = BoundaryTables.compile(def);
            log.info("[TABLES] загружены таблицы клинической границы revision={} substitutions={} allowedLabels={} phiCategories={}",
                    tables.revision(),
                    tables.abstractionFilter().substitutionCount(),
                    tables.allowedLabels().size(),
                    tables.phiCategories().size());
            return tables;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Не удалось загрузить таблицы клинической границы из " + tablesPath + ": " + e.getMessage(), e);
        }
    }

    private Optional<InputStream> open(String path) {
        if (resourceResolver != null) {
            return resourceResolver.getResourceAsStream(path);
        }
        // Без DI-контекста (юнит-тесты) поддерживаем только classpath.
        String p = path.startsWith(CLASSPATH_PREFIX) ? path.substring(CLASSPATH_PREFIX.length()) : path;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = BoundaryTablesStore.class.getClassLoader();
        }
        return Optional.ofNullable(cl.getResourceAsStream(p));
    }
}
