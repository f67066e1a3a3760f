package com.ryuqq.scapipeline.application.runtime;

/**
 * Endpoint message-processing runtime.
 *
 * <p>Implementations receive messages from one endpoint and process them: the worker runtime executes a
 * stage handler per job request, the orchestrator runtime applies results to the run state machine.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   1. Receive the next message from the endpoint (bounded wait)
 *   2. Process it
 *   3. Acknowledge on success, negative-acknowledge on failure
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked repeatedly by a loop or once for one-shot workers</li>
 *   <li>Implementations must tolerate duplicate deliveries (at-least-once)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: receive, process, acknowledge.
     *
     * @return true if a message was received, false if the wait timed out
     * @throws InterruptedException if interrupted while waiting for a message
     */
    boolean pump() throws InterruptedException;
}
