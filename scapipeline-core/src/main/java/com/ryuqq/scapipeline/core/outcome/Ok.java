package com.ryuqq.scapipeline.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 성공 값
 * @param <T> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
