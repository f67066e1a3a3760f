package com.ryuqq.scapipeline.worker.stage.reporter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.scapipeline.core.contract.JobRequest.ReporterRequest;
import com.ryuqq.scapipeline.core.contract.JobResult.ReporterWorkerResult;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.Organization;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.PluginConfiguration;
import com.ryuqq.scapipeline.core.model.Product;
import com.ryuqq.scapipeline.core.model.Repository;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.model.StageConfiguration;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;

/**
 * ReporterWorker / ReportFormatRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ReporterWorkerTest {

    private static final Hierarchy HIERARCHY = new Hierarchy(
        new Repository(3L, 1L, 2L, "https://example.org/repo.git"),
        new Product(2L, 1L, "product"),
        new Organization(1L, "org")
    );

    @Mock
    private WorkerContext context;

    @TempDir
    Path outputDir;

    private final Map<String, Path> stored = new LinkedHashMap<>();
    private final ReportStorage storage = (runId, name, file) -> stored.put(name, file);

    private void givenRun(StageConfiguration reporterConfig, List<Issue> issues) {
        Run run = Run.create(4L, HIERARCHY, "main", JobConfigurations.none().with(PipelineStage.REPORTER, reporterConfig), null, "trace")
            .appendIssues(issues);
        when(context.getRun()).thenReturn(run);
        when(context.getHierarchy()).thenReturn(HIERARCHY);
        when(context.createTempDir()).thenReturn(outputDir);
        when(context.resolvePluginConfigSecrets(anyMap())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void handle_활성화된_포맷으로_보고서를_생성하고_저장함() throws Exception {
        // given
        givenRun(
            StageConfiguration.withPlugins(RunSummaryReportFormat.NAME),
            List.of(Issue.of("analyzer", "problem", Severity.WARNING))
        );
        ReporterWorker worker = new ReporterWorker(ReportFormatRegistry.of(List.of(new RunSummaryReportFormat())), storage);

        // when
        ReporterWorkerResult result = (ReporterWorkerResult) worker.handle(context, new ReporterRequest(4L));

        // then
        assertThat(result.reportNames()).containsExactly(RunSummaryReportFormat.DEFAULT_FILE_NAME);
        assertThat(result.issues()).isEmpty();

        JsonNode summary = new ObjectMapper().readTree(Files.readString(stored.get(RunSummaryReportFormat.DEFAULT_FILE_NAME)));
        assertThat(summary.get("runId").asLong()).isEqualTo(4L);
        assertThat(summary.get("repositoryUrl").asText()).isEqualTo("https://example.org/repo.git");
        assertThat(summary.get("issueCounts").get("WARNING").asLong()).isEqualTo(1L);
        assertThat(summary.get("issues").get(0).get("message").asText()).isEqualTo("problem");
    }

    @Test
    void handle_알_수_없는_포맷은_ERROR_Issue() throws Exception {
        // given
        givenRun(StageConfiguration.withPlugins("Pdf"), List.of());
        ReporterWorker worker = new ReporterWorker(ReportFormatRegistry.of(List.of(new RunSummaryReportFormat())), storage);

        // when
        ReporterWorkerResult result = (ReporterWorkerResult) worker.handle(context, new ReporterRequest(4L));

        // then
        assertThat(result.reportNames()).isEmpty();
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.ERROR);
            assertThat(issue.message()).contains("Pdf").contains(RunSummaryReportFormat.NAME);
        });
    }

    @Test
    void handle_포맷_실패는_Issue로_기록하고_나머지를_계속함() throws Exception {
        // given
        ReportFormat failing = new ReportFormat() {
            @Override
            public String name() {
                return "Broken";
            }

            @Override
            public List<Path> generate(ReportInput input, Path outputDirectory, PluginConfiguration configuration) {
                throw new IllegalStateException("template missing");
            }
        };
        givenRun(StageConfiguration.withPlugins("Broken", RunSummaryReportFormat.NAME), List.of());
        ReporterWorker worker = new ReporterWorker(
            ReportFormatRegistry.of(List.of(failing, new RunSummaryReportFormat())), storage
        );

        // when
        ReporterWorkerResult result = (ReporterWorkerResult) worker.handle(context, new ReporterRequest(4L));

        // then
        assertThat(result.reportNames()).containsExactly(RunSummaryReportFormat.DEFAULT_FILE_NAME);
        assertThat(result.issues()).singleElement()
            .satisfies(issue -> assertThat(issue.message()).isEqualTo("Failed to generate report 'Broken': template missing"));
    }

    @Test
    void handle_플러그인_옵션을_포맷에_전달함() throws Exception {
        // given
        StageConfiguration config = new StageConfiguration(
            Map.of(),
            List.of(RunSummaryReportFormat.NAME),
            Map.of(RunSummaryReportFormat.NAME, PluginConfiguration.ofOptions(Map.of("fileName", "summary.json")))
        );
        givenRun(config, List.of());
        ReporterWorker worker = new ReporterWorker(ReportFormatRegistry.of(List.of(new RunSummaryReportFormat())), storage);

        // when
        ReporterWorkerResult result = (ReporterWorkerResult) worker.handle(context, new ReporterRequest(4L));

        // then
        assertThat(result.reportNames()).containsExactly("summary.json");
    }

    @Test
    void registry_중복_이름은_거부됨() {
        assertThatThrownBy(() -> ReportFormatRegistry.of(List.of(new RunSummaryReportFormat(), new RunSummaryReportFormat())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(RunSummaryReportFormat.NAME);
    }

    @Test
    void registry_load는_ServiceLoader_등록_포맷을_포함함() {
        assertThat(ReportFormatRegistry.load().find(RunSummaryReportFormat.NAME)).isPresent();
    }
}
