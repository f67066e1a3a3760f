package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.application.runtime.Runtime;
import com.ryuqq.scapipeline.core.contract.Envelope;
import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.model.PipelineStage;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.MessageSender;
import com.ryuqq.scapipeline.core.transport.ReceivedMessage;
import com.ryuqq.scapipeline.worker.context.WorkerContext;
import com.ryuqq.scapipeline.worker.context.WorkerContextFactory;
import com.ryuqq.scapipeline.worker.stage.StageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Worker Endpoint Runner 구현체.
 *
 * <p>단계 endpoint에서 job request를 받아 stage handler를 실행하고, 결과를 Orchestrator endpoint로 보냅니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * receiver.receive(pollTimeoutMs) → ReceivedMessage
 *   ↓
 * 1. contextFactory.createContext(runId)
 * 2. handler.handle(context, request) → JobResult
 *    - 예외 → WorkerError(stage, runId, 예외 메시지)
 * 3. context.close() (항상)
 * 4. resultSender.send(같은 header + JobResult)
 * 5. receiver.ack(message)
 *    - 결과 전송 실패 → receiver.nack(message) (재전달)
 * </pre>
 *
 * <p><strong>실행 방식:</strong></p>
 * <ul>
 *   <li>ONESHOT: 메시지 하나를 처리하면 {@link #run()}이 반환</li>
 *   <li>LOOP: {@link #stop()} 또는 인터럽트까지 계속 처리</li>
 * </ul>
 *
 * <p>두 방식 모두 같은 {@link #pump()} 로직을 사용합니다.</p>
 *
 * @param <T> handler가 처리하는 요청 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerEndpointRunner<T extends JobRequest> implements Runtime, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerEndpointRunner.class);

    private final MessageReceiver<JobRequest> receiver;
    private final MessageSender<OrchestratorMessage> resultSender;
    private final WorkerContextFactory contextFactory;
    private final StageHandler<T> handler;
    private final WorkerEndpointConfig config;
    private volatile boolean running = true;

    /**
     * 생성자.
     *
     * @param receiver 단계 endpoint receiver
     * @param resultSender Orchestrator endpoint sender
     * @param contextFactory Worker Context 팩토리
     * @param handler stage handler
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerEndpointRunner(
        MessageReceiver<JobRequest> receiver,
        MessageSender<OrchestratorMessage> resultSender,
        WorkerContextFactory contextFactory,
        StageHandler<T> handler,
        WorkerEndpointConfig config
    ) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (resultSender == null) {
            throw new IllegalArgumentException("resultSender cannot be null");
        }
        if (contextFactory == null) {
            throw new IllegalArgumentException("contextFactory cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.receiver = receiver;
        this.resultSender = resultSender;
        this.contextFactory = contextFactory;
        this.handler = handler;
        this.config = config;
    }

    @Override
    public boolean pump() throws InterruptedException {
        Optional<ReceivedMessage<JobRequest>> received = receiver.receive(config.pollTimeoutMs());
        if (received.isEmpty()) {
            return false;
        }

        ReceivedMessage<JobRequest> message = received.get();
        JobRequest request = message.envelope().payload();
        if (message.redelivered()) {
            log.info("Redelivered {} request for run {}", request.stage(), request.runId());
        }

        JobResult result = execute(request);
        Envelope<OrchestratorMessage> reply = message.envelope().<OrchestratorMessage>reply(result);
        try {
            resultSender.send(reply);
        } catch (RuntimeException e) {
            log.error("Failed to send {} result for run {}, returning request for redelivery",
                request.stage(), request.runId(), e);
            receiver.nack(message);
            return true;
        }

        receiver.ack(message);
        return true;
    }

    /**
     * 설정된 실행 방식으로 처리 루프 실행.
     *
     * <p>ONESHOT은 메시지 하나를 처리하면 반환하고, LOOP는 {@link #stop()}까지 반환하지 않습니다.
     * 인터럽트되면 인터럽트 플래그를 복원하고 반환합니다.</p>
     *
     * <p>LOOP에서 transport 실패는 ERROR로 기록한 뒤 poll timeout만큼 쉬고 계속 처리합니다.
     * ONESHOT에서는 호출자에게 전파됩니다.</p>
     *
     * @throws RuntimeException ONESHOT에서 transport가 실패한 경우
     */
    public void run() {
        log.info("Worker for {} started in {} mode", handler.requestType().getSimpleName(), config.mode().value());
        try {
            while (running) {
                boolean processed = pumpSurvivingFailures();
                if (processed && config.mode() == WorkerMode.ONESHOT) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Worker for {} interrupted", handler.requestType().getSimpleName());
        }
        log.info("Worker for {} stopped", handler.requestType().getSimpleName());
    }

    private boolean pumpSurvivingFailures() throws InterruptedException {
        try {
            return pump();
        } catch (RuntimeException e) {
            if (config.mode() == WorkerMode.ONESHOT) {
                throw e;
            }
            log.error("Worker for {} failed to process a message, retrying after {} ms",
                handler.requestType().getSimpleName(), config.pollTimeoutMs(), e);
            Thread.sleep(config.pollTimeoutMs());
            return false;
        }
    }

    /**
     * 현재 메시지 처리 후 루프 종료 요청.
     */
    public void stop() {
        running = false;
    }

    /**
     * transport 자원 해제.
     */
    @Override
    public void close() {
        try {
            receiver.close();
        } finally {
            resultSender.close();
        }
    }

    /**
     * 요청 1건 실행. 모든 실패는 WorkerError로 변환됩니다.
     *
     * @param request job request
     * @return 단계 결과 또는 WorkerError
     */
    JobResult execute(JobRequest request) {
        PipelineStage stage = request.stage();
        long runId = request.runId();
        if (!handler.requestType().isInstance(request)) {
            log.error("Handler for {} cannot process {} request of run {}",
                handler.requestType().getSimpleName(), stage, runId);
            return new JobResult.WorkerError(stage, runId,
                "Unsupported request " + request.getClass().getSimpleName()
                    + " for handler of " + handler.requestType().getSimpleName());
        }

        WorkerContext context = null;
        try {
            context = contextFactory.createContext(runId);
            JobResult result = handler.handle(context, handler.requestType().cast(request));
            log.info("Stage {} completed for run {} with {} issue(s)", stage, runId, result.issues().size());
            return result;
        } catch (Exception e) {
            log.error("Stage {} failed for run {}", stage, runId, e);
            return new JobResult.WorkerError(stage, runId, diagnostic(e));
        } finally {
            closeContext(context, runId);
        }
    }

    private static void closeContext(WorkerContext context, long runId) {
        if (context == null) {
            return;
        }
        try {
            context.close();
        } catch (RuntimeException e) {
            log.warn("Failed to clean up worker context of run {}", runId, e);
        }
    }

    /**
     * 예외의 진단 메시지 (메시지가 없으면 클래스 이름).
     *
     * @param e 예외
     * @return 진단 메시지
     */
    static String diagnostic(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getName() : message;
    }
}
