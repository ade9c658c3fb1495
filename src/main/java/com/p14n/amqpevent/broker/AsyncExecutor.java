package com.p14n.amqpevent.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Interface for asynchronous task execution.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Submits a task for execution and returns a Future representing the pending
     * result.
     *
     * @param task The task to submit
     * @param <T>  The type of the task's result
     * @return A Future representing pending completion of the task
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Shuts down the executor, interrupting running tasks, and returns a list of
     * runnables that were not executed.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    /**
     * Stops accepting tasks and releases the executor's threads.
     */
    @Override
    void close();
}
