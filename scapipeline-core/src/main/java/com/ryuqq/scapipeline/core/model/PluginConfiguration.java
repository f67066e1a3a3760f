package com.ryuqq.scapipeline.core.model;

import java.util.Map;

/**
 * 플러그인 설정 (옵션 + secret 참조).
 *
 * <p>secrets의 값은 secret 경로이며, Worker Context가 실제 값으로 치환합니다.</p>
 *
 * @param options 일반 옵션
 * @param secrets 옵션 이름 → secret 참조
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PluginConfiguration(
    Map<String, String> options,
    Map<String, String> secrets
) {

    public PluginConfiguration {
        options = options == null ? Map.of() : Map.copyOf(options);
        secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
    }

    /**
     * secret 없이 옵션만으로 생성.
     *
     * @param options 일반 옵션
     * @return PluginConfiguration
     */
    public static PluginConfiguration ofOptions(Map<String, String> options) {
        return new PluginConfiguration(options, Map.of());
    }
}
