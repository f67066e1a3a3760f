/**
 * Collaborator Service Provider Interfaces.
 *
 * <p>Interfaces to the systems the pipeline relies on but does not own: run persistence, the
 * organization hierarchy, secret references and values, infrastructure services and the
 * configuration-file provider.</p>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g. scapipeline-adapter-inmemory) provide concrete implementations.
 * The core and worker modules depend only on these interfaces.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scapipeline.core.spi;
