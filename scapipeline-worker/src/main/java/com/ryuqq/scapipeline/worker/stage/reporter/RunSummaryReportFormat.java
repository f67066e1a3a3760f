package com.ryuqq.scapipeline.worker.stage.reporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in format writing a JSON summary of the run and its issues.
 *
 * <p>Option {@code fileName} overrides the default file name.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunSummaryReportFormat implements ReportFormat {

    public static final String NAME = "RunSummary";

    public static final String FILE_NAME_OPTION = "fileName";

    static final String DEFAULT_FILE_NAME = "run-summary.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Path> generate(ReportInput input, Path outputDirectory, PluginConfiguration configuration)
        throws Exception {
        Run run = input.run();
        Hierarchy hierarchy = input.hierarchy();

        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Issue issue : run.issues()) {
            counts.merge(issue.severity(), 1L, Long::sum);
        }

        RunSummary summary = new RunSummary(
            run.id(),
            hierarchy.organization().name(),
            hierarchy.product().name(),
            hierarchy.repository().url(),
            run.revision(),
            run.labels(),
            counts,
            run.issues()
        );

        String fileName = configuration.options().getOrDefault(FILE_NAME_OPTION, DEFAULT_FILE_NAME);
        Path file = outputDirectory.resolve(fileName);
        MAPPER.writeValue(file.toFile(), summary);
        return List.of(file);
    }

    record RunSummary(
        long runId,
        String organization,
        String product,
        String repositoryUrl,
        String revision,
        Map<String, String> labels,
        Map<Severity, Long> issueCounts,
        List<Issue> issues
    ) {
    }
}
