package com.ryuqq.scapipeline.worker.environment.definition;

/**
 * How NPM credentials are written to {@code .npmrc}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum NpmAuthMode {

    /** {@code _password} holds the base64 encoded password, together with {@code username}. */
    PASSWORD,

    /** {@code _auth} holds base64 of {@code username:password}. */
    USERNAME_PASSWORD_AUTH,

    /** {@code _authToken} holds the password as a token. */
    PASSWORD_AUTH_TOKEN
}
