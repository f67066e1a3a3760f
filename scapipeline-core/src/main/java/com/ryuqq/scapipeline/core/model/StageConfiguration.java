package com.ryuqq.scapipeline.core.model;

import java.util.List;
import java.util.Map;

/**
 * 단일 단계의 job configuration.
 *
 * @param parameters 단계 파라미터
 * @param enabledPlugins 사용할 플러그인 이름 (예: reporter의 report format)
 * @param pluginConfigs 플러그인 이름 → 설정
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageConfiguration(
    Map<String, String> parameters,
    List<String> enabledPlugins,
    Map<String, PluginConfiguration> pluginConfigs
) {

    public StageConfiguration {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        enabledPlugins = enabledPlugins == null ? List.of() : List.copyOf(enabledPlugins);
        pluginConfigs = pluginConfigs == null ? Map.of() : Map.copyOf(pluginConfigs);
    }

    /**
     * 기본값만 가진 설정.
     *
     * @return 빈 StageConfiguration
     */
    public static StageConfiguration defaults() {
        return new StageConfiguration(Map.of(), List.of(), Map.of());
    }

    /**
     * 플러그인 목록만 지정한 설정.
     *
     * @param plugins 사용할 플러그인 이름
     * @return StageConfiguration
     */
    public static StageConfiguration withPlugins(String... plugins) {
        return new StageConfiguration(Map.of(), List.of(plugins), Map.of());
    }
}
