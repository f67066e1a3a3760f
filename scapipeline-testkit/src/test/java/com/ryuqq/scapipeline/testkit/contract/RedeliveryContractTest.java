package com.ryuqq.scapipeline.testkit.contract;

import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryQueue;
import com.ryuqq.scapipeline.adapter.inmemory.transport.InMemoryQueue.Delivery;
import com.ryuqq.scapipeline.adapter.runner.WorkerEndpointRunner;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.statemachine.RunStatus;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ack 전에 중단된 worker의 요청 재전달 계약 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RedeliveryContractTest extends AbstractPipelineContractTest {

    @Test
    void ack되지_않은_요청은_다른_worker에게_재전달됨() throws Exception {
        // given
        createRun(1L, PipelineStage.SCANNER);
        startRun(1L);
        completeStage(configWorker());

        InMemoryQueue scannerQueue = broker.queue(PipelineStage.SCANNER.endpointName());
        Optional<Delivery> abandoned = scannerQueue.receive(TIMEOUT_MS);
        assertThat(abandoned).isPresent();
        assertThat(scannerQueue.inFlightSize()).isEqualTo(1);

        // when
        int expired = scannerQueue.expireVisibilityTimeouts();
        completeStage(worker(PipelineStage.SCANNER, succeedingHandler(List.of())));

        // then
        assertThat(expired).isEqualTo(1);
        assertThat(scannerQueue.inFlightSize()).isZero();
        assertRunStatus(1L, RunStatus.FINISHED);
    }

    @Test
    void 재전달로_두_번_처리된_요청의_두_번째_결과는_폐기됨() throws Exception {
        // given
        createRun(2L, PipelineStage.SCANNER);
        startRun(2L);
        completeStage(configWorker());
        AtomicInteger executions = new AtomicInteger();
        StageHandler<JobRequest> countingHandler = new StageHandler<>() {
            @Override
            public Class<JobRequest> requestType() {
                return JobRequest.class;
            }

            @Override
            public JobResult handle(WorkerContext context, JobRequest request) {
                executions.incrementAndGet();
                return JobResult.success(request.stage(), request.runId(), List.of());
            }
        };
        InMemoryQueue scannerQueue = broker.queue(PipelineStage.SCANNER.endpointName());
        Delivery first = scannerQueue.receive(TIMEOUT_MS).orElseThrow();
        scannerQueue.expireVisibilityTimeouts();

        // when
        try (WorkerEndpointRunner<JobRequest> scanner = worker(PipelineStage.SCANNER, countingHandler)) {
            assertThat(scanner.pump()).isTrue();
        }
        scannerQueue.send(first.envelope());
        try (WorkerEndpointRunner<JobRequest> scanner = worker(PipelineStage.SCANNER, countingHandler)) {
            assertThat(scanner.pump()).isTrue();
        }
        processOrchestratorMessage();
        processOrchestratorMessage();

        // then
        assertThat(executions).hasValue(2);
        assertRunStatus(2L, RunStatus.FINISHED);
        assertThat(broker.queue("orchestrator").readySize()).isZero();
    }
}
