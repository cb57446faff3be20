package com.wpanther.fpolifecycle.client;

import com.wpanther.fpolifecycle.exception.ExternalServiceException;
import com.wpanther.fpolifecycle.exception.ExternalTimeoutException;
import com.wpanther.fpolifecycle.exception.LifecycleException;
import com.wpanther.fpolifecycle.exception.TransitionCancelledException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs blocking calls to the access-control service with a per-attempt timeout and
 * retries of transient failures.
 * <p>
 * Every failure leaves this class as an {@link ExternalServiceException} subtype, except
 * an interrupted caller which gets {@link TransitionCancelledException}.
 */
@Component
@Slf4j
public class ExternalCallExecutor {

    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    public ExternalCallExecutor(Retry accessControlRetry,
                                TimeLimiter accessControlTimeLimiter,
                                @Qualifier("accessControlCallPool") Executor executor) {
        this.retry = accessControlRetry;
        this.timeLimiter = accessControlTimeLimiter;
        this.executor = executor;
    }

    public <T> T call(String operation, Supplier<T> call) {
        return execute(operation, call);
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    private <T> T execute(String operation, Supplier<T> call) {
        Supplier<T> limited = () -> attempt(operation, call);
        return Retry.decorateSupplier(retry, limited).get();
    }

    private <T> T attempt(String operation, Supplier<T> call) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TransitionCancelledException(operation + " cancelled before it started", null, null);
        }
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException e) {
            log.warn("External call timed out: operation={}, timeout={}",
                    operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new ExternalTimeoutException(operation + " timed out after "
                    + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransitionCancelledException(operation + " cancelled while waiting for a response", null, e);
        } catch (LifecycleException e) {
            throw e;
        } catch (Exception e) {
            log.error("External call failed: operation={}", operation, e);
            throw new ExternalServiceException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
