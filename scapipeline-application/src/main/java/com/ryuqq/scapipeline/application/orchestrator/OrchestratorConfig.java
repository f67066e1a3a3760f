package com.ryuqq.scapipeline.application.orchestrator;

import com.ryuqq.scapipeline.core.model.Severity;
import org.slf4j.event.Level;

/**
 * Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>discardLogLevel: 중복/지연 결과를 버릴 때 사용하는 로그 레벨 (기본 WARN)</li>
 *   <li>issueThreshold: FINISHED_WITH_ISSUES로 판단하는 최소 Issue 심각도 (기본 WARNING)</li>
 * </ul>
 *
 * <p>중복/지연 결과는 at-least-once 전달에서 정상적으로 발생하므로, 운영 환경에 따라
 * DEBUG/INFO로 낮추거나 ERROR로 올려 알림 대상으로 만들 수 있습니다.</p>
 *
 * @param discardLogLevel 폐기 로그 레벨
 * @param issueThreshold Issue 심각도 기준
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OrchestratorConfig(
    Level discardLogLevel,
    Severity issueThreshold
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: discardLogLevel=WARN, issueThreshold=WARNING</p>
     */
    public OrchestratorConfig() {
        this(Level.WARN, Severity.WARNING);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public OrchestratorConfig {
        if (discardLogLevel == null) {
            throw new IllegalArgumentException("discardLogLevel cannot be null");
        }
        if (issueThreshold == null) {
            throw new IllegalArgumentException("issueThreshold cannot be null");
        }
    }

    /**
     * discardLogLevel만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDiscardLogLevel(Level discardLogLevel) {
        return new OrchestratorConfig(discardLogLevel, issueThreshold);
    }

    /**
     * issueThreshold만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withIssueThreshold(Severity issueThreshold) {
        return new OrchestratorConfig(discardLogLevel, issueThreshold);
    }
}
