package com.ryuqq.scapipeline.application.orchestrator;

import com.ryuqq.scapipeline.core.contract.CancelRun;
import com.ryuqq.scapipeline.core.contract.CreateRun;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.JobResult.ConfigWorkerResult;
import com.ryuqq.scapipeline.core.contract.JobResult.WorkerError;
import com.ryuqq.scapipeline.core.contract.MessageHeader;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.Issue;
import com.ryuqq.scapipeline.core.model.JobConfigurations;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.model.Run;
import com.ryuqq.scapipeline.core.model.Severity;
import com.ryuqq.scapipeline.core.spi.RunRepository;
import com.ryuqq.scapipeline.core.statemachine.RunStatus;
import com.ryuqq.scapipeline.core.statemachine.RunStatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Run 상태 머신.
 *
 * <p>Orchestrator endpoint로 들어오는 메시지를 소비하여 Run 상태를 전이하고 다음 단계를 dispatch합니다.
 * 전이는 생성 트리거, 단계 결과, 취소 요청으로만 일어나며 polling은 없습니다.</p>
 *
 * <p><strong>처리 흐름 (단계 N 결과 수신):</strong></p>
 * <pre>
 * handle(result)
 *   ↓ Run 잠금 (runId 단위 직렬화)
 * 1. 폐기 판단: 종료 상태 / currentStage 불일치 / traceId 불일치 → 로그 후 폐기
 * 2. WorkerError → ERROR Issue 추가 → FAILED
 * 3. 성공 → Issue/해석된 설정 반영
 * 4. 다음 요청 단계 존재 → currentStage 갱신 저장 → dispatch
 *    마지막 단계 → FINISHED 또는 FINISHED_WITH_ISSUES
 * </pre>
 *
 * <p><strong>인과 순서 보장:</strong></p>
 * <ul>
 *   <li>단계 N+1 요청은 단계 N 결과가 처리된 뒤에만 dispatch</li>
 *   <li>currentStage와 다른 단계의 결과는 반영하지 않음 (지연/중복 결과)</li>
 *   <li>dispatch 실패 시 저장한 상태를 되돌리고 예외 전파 → transport 재전달로 재시도</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final RunRepository runRepository;
    private final JobDispatcher dispatcher;
    private final OrchestratorConfig config;
    private final RunLocks locks;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param runRepository Run 저장소
     * @param dispatcher job request 전송기
     */
    public Orchestrator(RunRepository runRepository, JobDispatcher dispatcher) {
        this(runRepository, dispatcher, new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * @param runRepository Run 저장소
     * @param dispatcher job request 전송기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Orchestrator(RunRepository runRepository, JobDispatcher dispatcher, OrchestratorConfig config) {
        if (runRepository == null) {
            throw new IllegalArgumentException("runRepository cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.runRepository = runRepository;
        this.dispatcher = dispatcher;
        this.config = config;
        this.locks = new RunLocks();
    }

    /**
     * Orchestrator endpoint 메시지 처리.
     *
     * @param envelope 수신한 메시지
     * @throws IllegalArgumentException envelope이 null인 경우
     * @throws com.ryuqq.scapipeline.core.transport.TransportException 다음 단계 dispatch 실패 시
     */
    public void handle(Envelope<OrchestratorMessage> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }

        OrchestratorMessage payload = envelope.payload();
        if (payload instanceof CreateRun createRun) {
            handleCreateRun(envelope.header(), createRun);
        } else if (payload instanceof CancelRun cancelRun) {
            cancel(cancelRun.runId());
        } else if (payload instanceof JobResult result) {
            handleResult(envelope.header(), result);
        }
    }

    /**
     * Run 시작: CREATED → ACTIVE, CONFIG 단계 dispatch.
     *
     * <p>이미 시작된 Run에 대한 중복 트리거는 폐기합니다.</p>
     *
     * @param header 트리거 메시지 header (token 전파용)
     * @param createRun 생성 트리거
     */
    public void handleCreateRun(MessageHeader header, CreateRun createRun) {
        locks.withLock(createRun.runId(), () -> {
            Optional<Run> found = findRun(createRun.runId());
            if (found.isEmpty()) {
                return;
            }

            Run run = found.get();
            if (run.status() != RunStatus.CREATED) {
                discard(run, "duplicate creation trigger");
                return;
            }

            Run started = run
                .withStatus(RunStatusTransition.transition(run.status(), RunStatus.ACTIVE))
                .withCurrentStage(PipelineStage.CONFIG);
            log.info("Run {} started (traceId={})", run.id(), run.traceId());
            advance(run, started, header);
        });
    }

    /**
     * 단계 결과 처리.
     *
     * @param header 결과 메시지 header
     * @param result 단계 결과
     */
    public void handleResult(MessageHeader header, JobResult result) {
        locks.withLock(result.runId(), () -> {
            Optional<Run> found = findRun(result.runId());
            if (found.isEmpty()) {
                return;
            }

            Run run = found.get();
            if (run.status().isTerminal()) {
                discard(run, result.stage() + " result for run in terminal state " + run.status());
                return;
            }
            if (run.currentStage() != result.stage()) {
                discard(run, result.stage() + " result while waiting for " + run.currentStage());
                return;
            }
            if (!run.traceId().equals(header.traceId())) {
                discard(run, result.stage() + " result with foreign traceId " + header.traceId());
                return;
            }

            if (result instanceof WorkerError error) {
                fail(run, error);
            } else {
                complete(run, result, header);
            }
        });
    }

    /**
     * Run 취소.
     *
     * <p>진행 중인 worker는 중단하지 않으며, 이후 도착하는 결과는 폐기됩니다.</p>
     *
     * @param runId 취소할 Run ID
     * @return 취소되었으면 true, Run이 없거나 이미 종료 상태이면 false
     */
    public boolean cancel(long runId) {
        return locks.withLock(runId, () -> {
            Optional<Run> found = findRun(runId);
            if (found.isEmpty()) {
                return false;
            }

            Run run = found.get();
            if (run.status().isTerminal()) {
                discard(run, "cancel request for run in terminal state " + run.status());
                return false;
            }

            runRepository.update(run.withStatus(RunStatusTransition.transition(run.status(), RunStatus.CANCELLED)));
            log.info("Run {} cancelled", runId);
            return true;
        });
    }

    private void complete(Run run, JobResult result, MessageHeader header) {
        Run updated = run.appendIssues(result.issues());
        if (result instanceof ConfigWorkerResult configResult) {
            updated = updated.withResolvedJobConfigs(
                configResult.resolvedJobConfigs(),
                configResult.resolvedJobConfigContext()
            );
        }

        Optional<PipelineStage> next = nextRequestedStage(updated.effectiveJobConfigs(), result.stage());
        if (next.isPresent()) {
            advance(run, updated.withCurrentStage(next.get()), header);
            return;
        }

        RunStatus terminal = updated.hasIssuesAtLeast(config.issueThreshold())
            ? RunStatus.FINISHED_WITH_ISSUES
            : RunStatus.FINISHED;
        runRepository.update(updated.withStatus(RunStatusTransition.transition(updated.status(), terminal)));
        log.info("Run {} completed with status {} after {}", run.id(), terminal, result.stage());
    }

    private void fail(Run run, WorkerError error) {
        Issue issue = Issue.of(error.stage().endpointName(), error.message(), Severity.ERROR);
        Run failed = run
            .appendIssues(List.of(issue))
            .withStatus(RunStatusTransition.transition(run.status(), RunStatus.FAILED));
        runRepository.update(failed);
        log.error("Run {} failed in stage {}: {}", run.id(), error.stage(), error.message());
    }

    /**
     * 새 currentStage를 저장한 뒤 해당 단계를 dispatch.
     *
     * <p>dispatch가 실패하면 이전 상태로 되돌린 뒤 예외를 전파합니다.</p>
     */
    private void advance(Run previous, Run next, MessageHeader header) {
        runRepository.update(next);
        try {
            dispatcher.dispatch(
                new MessageHeader(header.token(), next.traceId()),
                JobRequest.forStage(next.currentStage(), next.id())
            );
        } catch (RuntimeException e) {
            runRepository.update(previous);
            throw e;
        }
    }

    private Optional<PipelineStage> nextRequestedStage(JobConfigurations configs, PipelineStage completed) {
        Optional<PipelineStage> candidate = completed.next();
        while (candidate.isPresent() && !configs.requests(candidate.get())) {
            candidate = candidate.get().next();
        }
        return candidate;
    }

    private Optional<Run> findRun(long runId) {
        Optional<Run> run = runRepository.get(runId);
        if (run.isEmpty()) {
            log.warn("Ignoring message for unknown run {}", runId);
        }
        return run;
    }

    private void discard(Run run, String reason) {
        log.atLevel(config.discardLogLevel())
            .log("Discarding message for run {}: {}", run.id(), reason);
    }
}
