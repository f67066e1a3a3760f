package com.ryuqq.scapipeline.worker.context;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 키 단위 single-flight 캐시.
 *
 * <p>같은 키에 대한 동시 요청 중 하나만 loader를 실행하고, 나머지는 그 결과를 기다립니다.
 * 성공한 값은 캐시가 비워질 때까지 유지되며, 실패한 경우 항목을 제거하여 다음 요청이 다시 시도합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>키당 진행 중인 loader 실행은 최대 1개</li>
 *   <li>loader는 항목을 생성한 스레드에서만 실행</li>
 *   <li>loader 예외는 원래 타입 그대로 모든 대기자에게 전파</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SingleFlightCache<K, V> {

    private final ConcurrentHashMap<K, CompletableFuture<V>> entries = new ConcurrentHashMap<>();

    /**
     * 캐시된 값을 반환하거나, 없으면 loader로 한 번만 계산.
     *
     * @param key 키
     * @param loader 값 계산 함수 (null 반환 불가)
     * @return 캐시된 값
     * @throws RuntimeException loader가 던진 예외
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        CompletableFuture<V> existing = entries.get(key);
        if (existing == null) {
            CompletableFuture<V> created = new CompletableFuture<>();
            existing = entries.putIfAbsent(key, created);
            if (existing == null) {
                return load(key, created, loader);
            }
        }
        return await(existing);
    }

    /**
     * 모든 항목 제거.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * 캐시 항목 수.
     *
     * @return 항목 수 (진행 중인 항목 포함)
     */
    public int size() {
        return entries.size();
    }

    private V load(K key, CompletableFuture<V> created, Function<? super K, ? extends V> loader) {
        try {
            V value = loader.apply(key);
            if (value == null) {
                throw new IllegalStateException("Loader returned null for key " + key);
            }
            created.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            entries.remove(key, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
