package com.ryuqq.scapipeline.worker.stage;

import com.ryuqq.scapipeline.core.contract.JobRequest;
import com.ryuqq.scapipeline.core.contract.JobResult;
import com.ryuqq.scapipeline.worker.context.WorkerContext;

/**
 * Executes one pipeline stage for one job request.
 *
 * <p>Implementations return the stage's success result. Any exception thrown is converted into a
 * {@link JobResult.WorkerError} by the endpoint loop, so handlers do not catch failures they cannot
 * turn into issues.</p>
 *
 * @param <T> request type handled
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StageHandler<T extends JobRequest> {

    /**
     * Request type accepted by this handler.
     *
     * @return request class
     */
    Class<T> requestType();

    /**
     * Execute the stage.
     *
     * @param context context bound to the request's run, owned by the caller
     * @param request job request
     * @return stage result
     * @throws Exception any failure; reported as a worker error
     */
    JobResult handle(WorkerContext context, T request) throws Exception;
}
