package com.ryuqq.scapipeline.application.orchestrator;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Run ID 단위 상호 배제.
 *
 * <p>같은 Run에 대한 작업은 직렬화되고, 서로 다른 Run은 독립적으로 동시에 실행됩니다.
 * 잠금 항목은 사용 중인 스레드가 없어지면 제거됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>holders 증감은 {@link ConcurrentHashMap#compute} 안에서만 수행</li>
 *   <li>holders가 0이 되는 즉시 맵에서 제거</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RunLocks {

    private final ConcurrentHashMap<Long, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Run 잠금을 잡은 상태로 작업 실행.
     *
     * @param runId Run ID
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> T withLock(long runId, Supplier<T> action) {
        LockEntry entry = locks.compute(runId, (id, existing) -> {
            LockEntry current = existing != null ? existing : new LockEntry();
            current.holders++;
            return current;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.compute(runId, (id, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    /**
     * Run 잠금을 잡은 상태로 작업 실행 (결과 없음).
     *
     * @param runId Run ID
     * @param action 실행할 작업
     */
    void withLock(long runId, Runnable action) {
        withLock(runId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 현재 잠금 항목 수 (테스트 검증용).
     *
     * @return 잠금 항목 수
     */
    int size() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
