/**
 * Writers for package manager configuration files ({@code settings.xml}, {@code .npmrc},
 * {@code NuGet.Config}) and {@code .netrc}.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.worker.environment.generator;
