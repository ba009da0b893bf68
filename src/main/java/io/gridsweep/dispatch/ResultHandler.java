package io.gridsweep.dispatch;

import io.gridsweep.model.JobResult;

/** Invoked on the dispatch worker as soon as a combination's final outcome is known. */
@FunctionalInterface
public interface ResultHandler {
    ResultHandler IDENTITY = result -> result;

    JobResult handle(JobResult result) throws InterruptedException;
}
