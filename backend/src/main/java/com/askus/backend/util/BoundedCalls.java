package com.askus.backend.util;

import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking external call on the shared I/O pool and waits at most the
 * given timeout. On timeout, or when the waiting thread is interrupted, the
 * call is cancelled (its worker thread is interrupted) and an
 * {@link ExternalCallException} is thrown.
 */
public final class BoundedCalls {

    private final AsyncTaskExecutor executor;

    public BoundedCalls(AsyncTaskExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public <T> T call(String service, Duration timeout, Callable<T> work) {
        Future<T> future;
        try {
            future = executor.submit(work);
        } catch (RejectedExecutionException e) {
            throw new ExternalCallException(service, "executor saturated", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalCallException(service, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalCallException(service, "cancelled", e);
        } catch (CancellationException e) {
            throw new ExternalCallException(service, "cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            if (cause instanceof ExternalCallException ece) throw ece;
            throw new ExternalCallException(service, String.valueOf(cause.getMessage()), cause);
        }
    }
}
