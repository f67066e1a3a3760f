package com.ryuqq.scapipeline.core.model;

/**
 * Secret과 infrastructure service를 선언할 수 있는 scope.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SecretScope {

    ORGANIZATION("organization"),
    PRODUCT("product"),
    REPOSITORY("repository");

    private final String prefix;

    SecretScope(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Secret 경로에 사용되는 scope 접두사.
     *
     * @return 접두사 (소문자)
     */
    public String prefix() {
        return prefix;
    }
}
