package com.orbital.authentication;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.*;

import static com.orbital.authentication.AuthFailure.AUTHORITY_UNREACHABLE;

/**
 * Runs a call to the identity authority on an executor and waits at most a fixed duration for
 * it. A call that does not finish in time is cancelled and reported with the failure the
 * caller chose, so nothing waiting on the authority can wait forever.
 */
@Slf4j
public class BoundedCall {

    private final ExecutorService executor;
    private final Duration timeout;

    /**
     * Construct a new BoundedCall
     * @param executor Executor the call runs on
     * @param timeout Maximum time to wait for the call
     */
    public BoundedCall(ExecutorService executor, Duration timeout) {
        Objects.requireNonNull(executor, "Must provide an executor for bounded calls");
        Objects.requireNonNull(timeout, "Must provide a timeout for bounded calls");
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Run <code>call</code>, treating a timeout as {@link AuthFailure#AUTHORITY_UNREACHABLE}
     * @param call Call to the identity authority
     * @param <T> Result type
     * @return Result of the call
     * @throws IdentityException
     */
    public <T> T call(AuthorityCall<T> call) throws IdentityException {
        return call(call, AUTHORITY_UNREACHABLE);
    }

    /**
     * Run <code>call</code>, treating a timeout as <code>onTimeout</code>. An
     * {@link IdentityException} thrown by the call is passed through unchanged, anything
     * else is reported as {@link AuthFailure#AUTHORITY_UNREACHABLE}.
     * @param call Call to the identity authority
     * @param onTimeout Failure to report when the call takes too long
     * @param <T> Result type
     * @return Result of the call
     * @throws IdentityException
     */
    public <T> T call(AuthorityCall<T> call, AuthFailure onTimeout) throws IdentityException {
        Objects.requireNonNull(call, "Must provide a call to bound");
        Future<T> future = this.executor.submit(call::call);
        try {
            return future.get(this.timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new IdentityException(onTimeout, "Identity authority did not answer within " + this.timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Interrupted while waiting on the identity authority", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof IdentityException) { throw (IdentityException) cause; }
            throw new IdentityException(AUTHORITY_UNREACHABLE, "Call to the identity authority failed: " + cause.getMessage(), cause);
        }
    }

    public Duration getTimeout() { return this.timeout; }

    /**
     * A single call to the identity authority
     * @param <T> Result type
     */
    @FunctionalInterface
    public interface AuthorityCall<T> {
        T call() throws IdentityException;
    }

}
