package com.ryuqq.scapipeline.adapter.runner;

import com.ryuqq.scapipeline.application.orchestrator.Orchestrator;
import com.ryuqq.scapipeline.application.runtime.Runtime;
import com.ryuqq.scapipeline.core.contract.OrchestratorMessage;
import com.ryuqq.scapipeline.core.transport.MessageReceiver;
import com.ryuqq.scapipeline.core.transport.ReceivedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Orchestrator Endpoint Runner 구현체.
 *
 * <p>Orchestrator endpoint에서 메시지를 받아 스레드 풀에서 {@link Orchestrator#handle}로 처리합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * permits.acquire() → 처리 중 메시지 수를 concurrency로 제한
 *   ↓
 * receiver.receive(pollTimeoutMs)
 *   ↓
 * workerExecutor.submit:
 *   1. orchestrator.handle(envelope)
 *   2. 성공 → receiver.ack
 *      실패 → receiver.nack (재전달)
 *   3. permits.release()
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OrchestratorEndpointRunner implements Runtime, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorEndpointRunner.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final MessageReceiver<OrchestratorMessage> receiver;
    private final Orchestrator orchestrator;
    private final OrchestratorEndpointConfig config;
    private final ExecutorService workerExecutor;
    private final Semaphore permits;
    private volatile boolean running = true;

    /**
     * 생성자.
     *
     * @param receiver Orchestrator endpoint receiver
     * @param orchestrator Orchestrator
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OrchestratorEndpointRunner(
        MessageReceiver<OrchestratorMessage> receiver,
        Orchestrator orchestrator,
        OrchestratorEndpointConfig config
    ) {
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.receiver = receiver;
        this.orchestrator = orchestrator;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.permits = new Semaphore(config.concurrency());
    }

    @Override
    public boolean pump() throws InterruptedException {
        permits.acquire();
        Optional<ReceivedMessage<OrchestratorMessage>> received;
        try {
            received = receiver.receive(config.pollTimeoutMs());
        } catch (RuntimeException | InterruptedException e) {
            permits.release();
            throw e;
        }
        if (received.isEmpty()) {
            permits.release();
            return false;
        }

        ReceivedMessage<OrchestratorMessage> message = received.get();
        try {
            workerExecutor.submit(() -> process(message));
        } catch (RejectedExecutionException e) {
            permits.release();
            receiver.nack(message);
            throw e;
        }
        return true;
    }

    /**
     * {@link #stop()}까지 메시지 처리. 인터럽트되면 플래그를 복원하고 반환합니다.
     *
     * <p>transport 실패는 ERROR로 기록한 뒤 poll timeout만큼 쉬고 계속 처리합니다.</p>
     */
    public void run() {
        log.info("Orchestrator endpoint started (concurrency={})", config.concurrency());
        try {
            while (running) {
                try {
                    pump();
                } catch (RuntimeException e) {
                    log.error("Orchestrator endpoint failed to receive a message, retrying after {} ms",
                        config.pollTimeoutMs(), e);
                    Thread.sleep(config.pollTimeoutMs());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Orchestrator endpoint stopped");
    }

    public void stop() {
        running = false;
    }

    /**
     * 처리 중인 메시지가 끝날 때까지 대기 후 종료.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        running = false;
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 처리 중인 메시지가 모두 끝날 때까지 대기.
     *
     * @param timeoutMs 최대 대기 시간
     * @return 시간 안에 끝났으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        if (!permits.tryAcquire(config.concurrency(), timeoutMs, TimeUnit.MILLISECONDS)) {
            return false;
        }
        permits.release(config.concurrency());
        return true;
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        } finally {
            receiver.close();
        }
    }

    private void process(ReceivedMessage<OrchestratorMessage> message) {
        try {
            orchestrator.handle(message.envelope());
            receiver.ack(message);
        } catch (RuntimeException e) {
            log.error("Failed to process {} for run {}, returning it for redelivery",
                message.envelope().payload().getClass().getSimpleName(), message.envelope().payload().runId(), e);
            nackQuietly(message);
        } finally {
            permits.release();
        }
    }

    private void nackQuietly(ReceivedMessage<OrchestratorMessage> message) {
        try {
            receiver.nack(message);
        } catch (RuntimeException e) {
            log.error("Failed to nack message for run {}", message.envelope().payload().runId(), e);
        }
    }
}
