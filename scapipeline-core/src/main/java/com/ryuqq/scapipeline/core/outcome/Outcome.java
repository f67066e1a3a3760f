package com.ryuqq.scapipeline.core.outcome;

import java.util.function.Function;

/**
 * 해석/검증 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값을 가짐</li>
 *   <li>{@link Fail}: 실패, 구조화된 진단을 가짐</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 호출자는 두 경우를 모두 처리해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;InfrastructureService&gt; service = resolver.resolve(properties);
 * if (service instanceof Ok&lt;InfrastructureService&gt; ok) {
 *     use(ok.value());
 * } else if (service instanceof Fail&lt;InfrastructureService&gt; fail) {
 *     report(fail.message());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값으로 다음 단계를 이어서 실행.
     *
     * <p>실패인 경우 mapper를 호출하지 않고 같은 진단을 가진 실패를 반환합니다.</p>
     *
     * @param mapper 성공 값 → 다음 Outcome
     * @param <R> 다음 성공 값 타입
     * @return mapper 결과 또는 전파된 실패
     */
    default <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (this instanceof Ok<T> ok) {
            return mapper.apply(ok.value());
        }
        Fail<T> fail = (Fail<T>) this;
        return new Fail<>(fail.errorCode(), fail.message(), fail.cause());
    }
}
