package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.adapter.inmemory.store.InMemoryRunRepository;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryBroker;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryMessageReceiverFactory;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryMessageSenderFactory;
import com.ryuqq.scapipeline.application.orchestrator.JobDispatcher;
import com.ryuqq.scapipeline.application.orchestrator.Orchestrator;
import com.ryuqq.scapipeline.core.contract.CreateRun;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.MessagePayload;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.Hierarchy;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.Organization;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Product;
import com.ryuqq.scapipeline.core.model.Repository;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.statemachine.RunStatus;
import com.ryuqq.scapipeline.core.transport.Endpoint;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.TransportConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OrchestratorEndpointRunner 테스트 (in-memory transport).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OrchestratorEndpointRunnerTest {

    private static final Hierarchy HIERARCHY = new Hierarchy(
        new Repository(3L, 1L, 2L, "https://example.org/repo.git"),
        new Product(2L, 1L, "product"),
        new Organization(1L, "org")
    );

    private final InMemoryBroker broker = InMemoryBroker.getInstance();
    private InMemoryRunRepository runs;
    private MessageReceiver<OrchestratorMessage> receiver;
    private OrchestratorEndpointRunner runner;

    @BeforeEach
    void setUp() {
        broker.reset();
        runs = new InMemoryRunRepository();
        runs.create(Run.create(1L, HIERARCHY, "main", JobConfigurations.of(PipelineStage.SCANNER), null, "trace-1"));
        receiver = new InMemoryMessageReceiverFactory()
            .createReceiver(Endpoint.ORCHESTRATOR, TransportConfig.of("testing", "orchestrator"));
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
        broker.reset();
    }

    @Test
    void pump_CreateRun을_처리하고_ack함() throws Exception {
        // given
        JobDispatcher dispatcher = new JobDispatcher(Map.of(
            PipelineStage.CONFIG,
            new InMemoryMessageSenderFactory().createSender(Endpoint.CONFIG, TransportConfig.of("testing", "config"))
        ));
        runner = new OrchestratorEndpointRunner(receiver, new Orchestrator(runs, dispatcher), new OrchestratorEndpointConfig(2, 500));
        broker.inject(Endpoint.ORCHESTRATOR, Envelope.of(new MessageHeader("", "trace-1"), new CreateRun(1L)));

        // when
        boolean processed = runner.pump();
        boolean idle = runner.awaitIdle(2_000);

        // then
        assertThat(processed).isTrue();
        assertThat(idle).isTrue();
        assertThat(runs.get(1L)).map(Run::status).contains(RunStatus.ACTIVE);
        Optional<Envelope<? extends MessagePayload>> request = broker.awaitMessage(Endpoint.CONFIG, 1_000);
        assertThat(request).isPresent();
        assertThat(request.get().payload()).isEqualTo(new JobRequest.ConfigRequest(1L));
        assertThat(broker.queue("orchestrator").inFlightSize()).isZero();
    }

    @Test
    void pump_처리_실패한_메시지는_nack되어_재전달됨() throws Exception {
        // given
        JobDispatcher noSenders = new JobDispatcher(Map.of());
        runner = new OrchestratorEndpointRunner(receiver, new Orchestrator(runs, noSenders), new OrchestratorEndpointConfig(1, 500));
        broker.inject(Endpoint.ORCHESTRATOR, Envelope.of(new MessageHeader("", "trace-1"), new CreateRun(1L)));

        // when
        runner.pump();
        runner.awaitIdle(2_000);

        // then
        assertThat(runs.get(1L)).map(Run::status).contains(RunStatus.CREATED);
        assertThat(broker.queue("orchestrator").readySize()).isEqualTo(1);
        assertThat(broker.queue("orchestrator").inFlightSize()).isZero();
    }

    @Test
    void pump_메시지가_없으면_false() throws Exception {
        // given
        runner = new OrchestratorEndpointRunner(
            receiver, new Orchestrator(runs, new JobDispatcher(Map.of())), new OrchestratorEndpointConfig(1, 10)
        );

        // when & then
        assertThat(runner.pump()).isFalse();
        assertThat(runner.awaitIdle(100)).isTrue();
    }

    @Test
    void run_transport_실패_후에도_다음_메시지를_처리하고_ack함() throws Exception {
        // given
        JobDispatcher dispatcher = new JobDispatcher(Map.of(
            PipelineStage.CONFIG,
            new InMemoryMessageSenderFactory().createSender(Endpoint.CONFIG, TransportConfig.of("testing", "config"))
        ));
        FailingOnceReceiver<OrchestratorMessage> failingOnce =
            new FailingOnceReceiver<>(receiver, "Cannot read from queue 'orchestrator'");
        runner = new OrchestratorEndpointRunner(failingOnce, new Orchestrator(runs, dispatcher), new OrchestratorEndpointConfig(1, 50));
        broker.inject(Endpoint.ORCHESTRATOR, Envelope.of(new MessageHeader("", "trace-1"), new CreateRun(1L)));
        Thread thread = new Thread(runner::run, "orchestrator-test");

        // when
        thread.start();
        Optional<Envelope<? extends MessagePayload>> request = broker.awaitMessage(Endpoint.CONFIG, 2_000);
        runner.stop();
        thread.join(2_000);
        boolean idle = runner.awaitIdle(2_000);

        // then
        assertThat(thread.isAlive()).isFalse();
        assertThat(idle).isTrue();
        assertThat(failingOnce.receiveCalls()).isGreaterThanOrEqualTo(2);
        assertThat(request).isPresent();
        assertThat(runs.get(1L)).map(Run::status).contains(RunStatus.ACTIVE);
        assertThat(broker.queue("orchestrator").readySize()).isZero();
        assertThat(broker.queue("orchestrator").inFlightSize()).isZero();
    }
}
