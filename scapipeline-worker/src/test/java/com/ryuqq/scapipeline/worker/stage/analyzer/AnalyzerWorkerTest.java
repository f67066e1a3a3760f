package com.ryuqq.scapipeline.worker.stage.analyzer;

import com.ryuqq.scapipeline.core.contract.JobRequest.AnalyzerRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.JobResult.AnalyzerWorkerResult;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.Organization;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Product;
import com.ryuqq.scapipeline.core.model.Repository;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Secret;
import com.ryuqq.scapipeline.core.model.SecretScope;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.spi.InfrastructureServiceRepository;
import com.ryuqq.scapipeline.core.spi.SecretRepository;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.environment.EnvironmentConfigException;
import com.ryuqq.scapipeline.worker.environment.EnvironmentConfigLoader;
import com.ryuqq.scapipeline.worker.environment.EnvironmentService;
import com.ryuqq.scapipeline.worker.environment.definition.EnvironmentDefinitionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * AnalyzerWorker 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AnalyzerWorkerTest {

    private static final Hierarchy HIERARCHY = new Hierarchy(
        new Repository(3L, 1L, 2L, "https://example.org/repo.git"),
        new Product(2L, 1L, "product"),
        new Organization(1L, "org")
    );

    @Mock
    private WorkerContext context;

    @Mock
    private SecretRepository secretRepository;

    @Mock
    private InfrastructureServiceRepository serviceRepository;

    @TempDir
    Path workDir;

    @TempDir
    Path configDir;

    private EnvironmentConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EnvironmentConfigLoader(secretRepository, serviceRepository, EnvironmentDefinitionFactory.defaults());
        when(context.getRun()).thenReturn(
            Run.create(8L, HIERARCHY, "v1.0", JobConfigurations.of(PipelineStage.ANALYZER), null, "trace")
        );
        when(context.getHierarchy()).thenReturn(HIERARCHY);
    }

    private static RepositoryCheckout checkoutWithConfig(String yaml) {
        return (repository, revision, target) -> {
            if (yaml != null) {
                Files.writeString(target.resolve(EnvironmentConfigLoader.CONFIG_FILE_PATH), yaml);
            }
            return target;
        };
    }

    @Test
    void handle_환경을_준비하고_분석_Issue를_반환함() throws Exception {
        // given
        when(context.createTempDir()).thenReturn(workDir, configDir);
        Secret token = Secret.create(1L, SecretScope.REPOSITORY, 3L, "token", null);
        when(secretRepository.listForRepository(3L)).thenReturn(List.of(token));
        when(context.resolveSecret(token)).thenReturn("t0k3n");
        AtomicReference<Map<String, String>> seenEnvironment = new AtomicReference<>();
        DependencyAnalyzer analyzer = (repositoryDir, environment, configuration) -> {
            seenEnvironment.set(environment);
            return List.of(Issue.of("analyzer", "unresolved dependency", Severity.ERROR));
        };
        AnalyzerWorker worker = new AnalyzerWorker(
            checkoutWithConfig("""
                environmentVariables:
                - name: "TOKEN"
                  secretName: "token"
                """),
            loader, new EnvironmentService(), analyzer
        );

        // when
        JobResult result = worker.handle(context, new AnalyzerRequest(8L));

        // then
        assertThat(seenEnvironment.get()).containsEntry("TOKEN", "t0k3n");
        assertThat(result).isInstanceOfSatisfying(AnalyzerWorkerResult.class, analyzerResult ->
            assertThat(analyzerResult.issues()).extracting(Issue::message).containsExactly("unresolved dependency")
        );
    }

    @Test
    void handle_lenient_경고는_WARNING_Issue로_기록됨() throws Exception {
        // given
        when(context.createTempDir()).thenReturn(workDir, configDir);
        when(secretRepository.listForRepository(3L)).thenReturn(List.of());
        when(secretRepository.listForProduct(2L)).thenReturn(List.of());
        when(secretRepository.listForOrganization(1L)).thenReturn(List.of());
        AnalyzerWorker worker = new AnalyzerWorker(
            checkoutWithConfig("""
                strict: false
                environmentVariables:
                - name: "TOKEN"
                  secretName: "missing"
                """),
            loader, new EnvironmentService(), (repositoryDir, environment, configuration) -> List.of()
        );

        // when
        JobResult result = worker.handle(context, new AnalyzerRequest(8L));

        // then
        assertThat(result.issues()).isNotEmpty().allSatisfy(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.WARNING);
            assertThat(issue.source()).isEqualTo("analyzer");
        });
        assertThat(result.issues().get(0).message()).contains("missing");
    }

    @Test
    void handle_strict_해석_실패는_예외로_전파됨() {
        // given
        when(context.createTempDir()).thenReturn(workDir);
        when(secretRepository.listForRepository(3L)).thenReturn(List.of());
        when(secretRepository.listForProduct(2L)).thenReturn(List.of());
        when(secretRepository.listForOrganization(1L)).thenReturn(List.of());
        AnalyzerWorker worker = new AnalyzerWorker(
            checkoutWithConfig("""
                environmentVariables:
                - name: "TOKEN"
                  secretName: "missing"
                """),
            loader, new EnvironmentService(), (repositoryDir, environment, configuration) -> List.of()
        );

        // when & then
        assertThatThrownBy(() -> worker.handle(context, new AnalyzerRequest(8L)))
            .isInstanceOf(EnvironmentConfigException.class)
            .hasMessageContaining("missing");
    }
}
