package com.ryuqq.scapipeline.worker.stage.reporter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Immutable table of report formats by name.
 *
 * <p>Built once at worker startup and passed to {@link ReporterWorker}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReportFormatRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReportFormatRegistry.class);

    private final Map<String, ReportFormat> formats;

    private ReportFormatRegistry(Map<String, ReportFormat> formats) {
        this.formats = Collections.unmodifiableMap(formats);
    }

    /**
     * Registry with the formats available through {@link ServiceLoader}.
     *
     * @return registry
     * @throws IllegalStateException if two formats share a name
     */
    public static ReportFormatRegistry load() {
        List<ReportFormat> loaded = new ArrayList<>();
        ServiceLoader.load(ReportFormat.class).forEach(loaded::add);
        ReportFormatRegistry registry = of(loaded);
        log.info("Loaded report formats: {}", registry.names());
        return registry;
    }

    /**
     * Registry with the given formats.
     *
     * @param formats formats
     * @return registry
     * @throws IllegalStateException if two formats share a name
     */
    public static ReportFormatRegistry of(List<? extends ReportFormat> formats) {
        if (formats == null) {
            throw new IllegalArgumentException("formats cannot be null");
        }
        Map<String, ReportFormat> byName = new LinkedHashMap<>();
        for (ReportFormat format : formats) {
            ReportFormat previous = byName.putIfAbsent(format.name(), format);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate report format '" + format.name() + "': "
                        + previous.getClass().getName() + ", " + format.getClass().getName()
                );
            }
        }
        return new ReportFormatRegistry(byName);
    }

    public Optional<ReportFormat> find(String name) {
        return Optional.ofNullable(formats.get(name));
    }

    public Set<String> names() {
        return formats.keySet();
    }
}
