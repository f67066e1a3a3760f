package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.adapter.inmemory.config.FileSystemConfigManager;
import com.ryuqq.scapipeline.adapter.inmemory.store.InMemoryHierarchyRepository;
import com.ryuqq.scapipeline.adapter.inmemory.store.InMemoryRunRepository;
import com.ryuqq.scapipeline.adapter.inmemory.store.InMemorySecretStore;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryBroker;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryMessageReceiverFactory;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryMessageSenderFactory;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.Organization;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Product;
import com.ryuqq.scapipeline.core.model.Repository;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.TransportConfig;
import com.ryuqq.scapipeline.core.transport.TransportException;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.context.WorkerContextFactory;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerEndpointRunner 테스트 (in-memory transport).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkerEndpointRunnerTest {

    private static final Hierarchy HIERARCHY = new Hierarchy(
        new Repository(3L, 1L, 2L, "https://example.org/repo.git"),
        new Product(2L, 1L, "product"),
        new Organization(1L, "org")
    );
    private static final MessageHeader HEADER = new MessageHeader("token-1", "trace-1");

    @TempDir
    Path configRoot;

    private final InMemoryBroker broker = InMemoryBroker.getInstance();
    private WorkerContextFactory contextFactory;
    private MessageReceiver<JobRequest> receiver;
    private MessageSender<OrchestratorMessage> resultSender;

    @BeforeEach
    void setUp() {
        broker.reset();
        InMemoryRunRepository runs = new InMemoryRunRepository();
        InMemoryHierarchyRepository hierarchies = new InMemoryHierarchyRepository();
        hierarchies.register(HIERARCHY);
        runs.create(Run.create(1L, HIERARCHY, "main", JobConfigurations.of(PipelineStage.SCANNER), null, "trace-1"));
        contextFactory = new WorkerContextFactory(runs, hierarchies, new InMemorySecretStore(), new FileSystemConfigManager(configRoot));
        receiver = new InMemoryMessageReceiverFactory().createReceiver(Endpoint.SCANNER, TransportConfig.of("testing", "scanner"));
        resultSender = new InMemoryMessageSenderFactory().createSender(Endpoint.ORCHESTRATOR, TransportConfig.of("testing", "orchestrator"));
    }

    @AfterEach
    void tearDown() {
        broker.reset();
    }

    // ============================================================
    // pump
    // ============================================================

    @Test
    void pump_성공_결과를_같은_header로_Orchestrator에_보냄() throws Exception {
        // given
        Issue issue = Issue.of("scanner", "license unknown", Severity.HINT);
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) ->
            new JobResult.ScannerWorkerResult(request.runId(), List.of(issue))));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        boolean processed = runner.pump();

        // then
        assertThat(processed).isTrue();
        Envelope<? extends MessagePayload> reply = broker.awaitMessage(Endpoint.ORCHESTRATOR, 1_000).orElseThrow();
        assertThat(reply.header()).isEqualTo(HEADER);
        assertThat(reply.header().token()).isEqualTo("token-1");
        assertThat(reply.payload()).isEqualTo(new JobResult.ScannerWorkerResult(1L, List.of(issue)));
        assertThat(broker.queue("scanner").inFlightSize()).isZero();
        assertThat(broker.queue("scanner").readySize()).isZero();
    }

    @Test
    void pump_메시지가_없으면_false() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) ->
            new JobResult.ScannerWorkerResult(request.runId(), List.of())));

        // when & then
        assertThat(runner.pump()).isFalse();
    }

    @Test
    void pump_handler_예외는_WorkerError로_변환됨() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) -> {
            throw new IllegalStateException("scanner crashed");
        }));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        runner.pump();

        // then
        Envelope<? extends MessagePayload> reply = broker.awaitMessage(Endpoint.ORCHESTRATOR, 1_000).orElseThrow();
        assertThat(reply.payload()).isEqualTo(new JobResult.WorkerError(PipelineStage.SCANNER, 1L, "scanner crashed"));
        assertThat(broker.queue("scanner").inFlightSize()).isZero();
    }

    @Test
    void pump_메시지_없는_예외는_클래스_이름을_진단으로_사용함() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) -> {
            throw new NullPointerException();
        }));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        runner.pump();

        // then
        JobResult.WorkerError error = (JobResult.WorkerError) broker.awaitMessage(Endpoint.ORCHESTRATOR, 1_000)
            .orElseThrow().payload();
        assertThat(error.message()).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    void pump_없는_Run은_WorkerError로_보고함() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) ->
            new JobResult.ScannerWorkerResult(request.runId(), List.of())));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(99L)));

        // when
        runner.pump();

        // then
        JobResult.WorkerError error = (JobResult.WorkerError) broker.awaitMessage(Endpoint.ORCHESTRATOR, 1_000)
            .orElseThrow().payload();
        assertThat(error.runId()).isEqualTo(99L);
        assertThat(error.message()).contains("99");
    }

    @Test
    void pump_다른_단계_요청은_WorkerError로_보고함() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) ->
            new JobResult.ScannerWorkerResult(request.runId(), List.of())));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.AdvisorRequest(1L)));

        // when
        runner.pump();

        // then
        JobResult.WorkerError error = (JobResult.WorkerError) broker.awaitMessage(Endpoint.ORCHESTRATOR, 1_000)
            .orElseThrow().payload();
        assertThat(error.stage()).isEqualTo(PipelineStage.ADVISOR);
        assertThat(error.message()).contains("AdvisorRequest");
    }

    @Test
    void pump_컨텍스트는_handler_실행_후_항상_닫힘() throws Exception {
        // given
        AtomicReference<Path> tempDir = new AtomicReference<>();
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = runner(handler((context, request) -> {
            tempDir.set(context.createTempDir());
            throw new IllegalStateException("after temp dir");
        }));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        runner.pump();

        // then
        assertThat(tempDir.get()).isNotNull();
        assertThat(Files.exists(tempDir.get())).isFalse();
    }

    @Test
    void pump_결과_전송_실패시_요청을_nack함() throws Exception {
        // given
        MessageSender<OrchestratorMessage> failingSender = envelope -> {
            throw new TransportException("broker down");
        };
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = new WorkerEndpointRunner<>(
            receiver, failingSender, contextFactory,
            handler((context, request) -> new JobResult.ScannerWorkerResult(request.runId(), List.of())),
            new WorkerEndpointConfig().withPollTimeoutMs(500)
        );
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        runner.pump();

        // then
        assertThat(broker.queue("scanner").readySize()).isEqualTo(1);
        Optional<?> redelivered = receiver.receive(500).filter(message -> message.redelivered());
        assertThat(redelivered).isPresent();
    }

    // ============================================================
    // run
    // ============================================================

    @Test
    void run_ONESHOT은_메시지_하나만_처리하고_반환함() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = new WorkerEndpointRunner<>(
            receiver, resultSender, contextFactory,
            handler((context, request) -> new JobResult.ScannerWorkerResult(request.runId(), List.of())),
            new WorkerEndpointConfig(WorkerMode.ONESHOT, 100)
        );
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));

        // when
        runner.run();

        // then
        assertThat(broker.queue("scanner").readySize()).isEqualTo(1);
        assertThat(broker.queue("orchestrator").readySize()).isEqualTo(1);
    }

    @Test
    void run_LOOP는_stop까지_계속_처리함() throws Exception {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = new WorkerEndpointRunner<>(
            receiver, resultSender, contextFactory,
            handler((context, request) -> new JobResult.ScannerWorkerResult(request.runId(), List.of())),
            new WorkerEndpointConfig(WorkerMode.LOOP, 50)
        );
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        Thread thread = new Thread(runner::run, "worker-test");

        // when
        thread.start();
        assertThat(broker.awaitMessage(Endpoint.ORCHESTRATOR, 2_000)).isPresent();
        assertThat(broker.awaitMessage(Endpoint.ORCHESTRATOR, 2_000)).isPresent();
        runner.stop();
        thread.join(2_000);

        // then
        assertThat(thread.isAlive()).isFalse();
    }

    @Test
    void run_LOOP는_transport_실패_후에도_다음_메시지를_처리하고_ack함() throws Exception {
        // given
        FailingOnceReceiver<JobRequest> failingOnce =
            new FailingOnceReceiver<>(receiver, "Rejected malformed message on queue 'scanner'");
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = new WorkerEndpointRunner<>(
            failingOnce, resultSender, contextFactory,
            handler((context, request) -> new JobResult.ScannerWorkerResult(request.runId(), List.of())),
            new WorkerEndpointConfig(WorkerMode.LOOP, 50)
        );
        broker.inject(Endpoint.SCANNER, Envelope.of(HEADER, new JobRequest.ScannerRequest(1L)));
        Thread thread = new Thread(runner::run, "worker-test");

        // when
        thread.start();
        Optional<Envelope<? extends MessagePayload>> reply = broker.awaitMessage(Endpoint.ORCHESTRATOR, 2_000);
        runner.stop();
        thread.join(2_000);

        // then
        assertThat(thread.isAlive()).isFalse();
        assertThat(failingOnce.receiveCalls()).isGreaterThanOrEqualTo(2);
        assertThat(reply).isPresent();
        assertThat(reply.get().payload()).isEqualTo(new JobResult.ScannerWorkerResult(1L, List.of()));
        assertThat(broker.queue("scanner").readySize()).isZero();
        assertThat(broker.queue("scanner").inFlightSize()).isZero();
    }

    @Test
    void run_ONESHOT은_transport_실패를_전파함() {
        // given
        WorkerEndpointRunner<JobRequest.ScannerRequest> runner = new WorkerEndpointRunner<>(
            new FailingOnceReceiver<>(receiver, "broker unavailable"), resultSender, contextFactory,
            handler((context, request) -> new JobResult.ScannerWorkerResult(request.runId(), List.of())),
            new WorkerEndpointConfig(WorkerMode.ONESHOT, 50)
        );

        // when & then
        assertThatThrownBy(runner::run)
            .isInstanceOf(TransportException.class)
            .hasMessage("broker unavailable");
    }

    // ============================================================
    // Helpers
    // ============================================================

    @FunctionalInterface
    private interface ScannerLogic {
        JobResult apply(WorkerContext context, JobRequest.ScannerRequest request) throws Exception;
    }

    private static StageHandler<JobRequest.ScannerRequest> handler(ScannerLogic logic) {
        return new StageHandler<>() {
            @Override
            public Class<JobRequest.ScannerRequest> requestType() {
                return JobRequest.ScannerRequest.class;
            }

            @Override
            public JobResult handle(WorkerContext context, JobRequest.ScannerRequest request) throws Exception {
                return logic.apply(context, request);
            }
        };
    }

    private WorkerEndpointRunner<JobRequest.ScannerRequest> runner(StageHandler<JobRequest.ScannerRequest> handler) {
        return new WorkerEndpointRunner<>(
            receiver, resultSender, contextFactory, handler, new WorkerEndpointConfig().withPollTimeoutMs(500)
        );
    }
}
