package com.judgmentrag.service.llm;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import com.judgmentrag.exception.ConfigurationException;
import com.judgmentrag.exception.ProviderTransientException;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a blocking model-provider call under a named time limit and a bounded retry.
 * <p>
 * Timeouts and provider failures surface as {@link ProviderTransientException}, which the
 * retry instances are configured to retry once. {@link ConfigurationException} passes
 * through untouched and is never retried. A call that runs past its limit is cancelled,
 * which interrupts the worker thread.
 */
@Slf4j
@Component
public class ProviderCallGuard {

    private final RetryRegistry retryRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final AsyncTaskExecutor executor;

    public ProviderCallGuard(RetryRegistry retryRegistry,
                             TimeLimiterRegistry timeLimiterRegistry,
                             @Qualifier("providerCallExecutor") AsyncTaskExecutor executor) {
        this.retryRegistry = retryRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    public <T> T call(String retryName, String timeLimiterName, Supplier<T> providerCall) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(timeLimiterName);
        Retry retry = retryRegistry.retry(retryName);

        Supplier<T> timed = () -> callWithTimeLimit(timeLimiter, providerCall);
        return Retry.decorateSupplier(retry, timed).get();
    }

    private <T> T callWithTimeLimit(TimeLimiter timeLimiter, Supplier<T> providerCall) {
        try {
            Callable<T> task = providerCall::get;
            return timeLimiter.executeFutureSupplier(() -> executor.submit(task));

        } catch (TimeoutException e) {
            log.warn("Provider call '{}' timed out after {}",
                    timeLimiter.getName(), timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new ProviderTransientException("Provider call timed out: " + timeLimiter.getName(), e);

        } catch (ConfigurationException | ProviderTransientException e) {
            throw e;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderTransientException("Provider call interrupted: " + timeLimiter.getName(), e);

        } catch (Exception e) {
            log.warn("Provider call '{}' failed: {}", timeLimiter.getName(), e.getMessage());
            throw new ProviderTransientException("Provider call failed: " + timeLimiter.getName(), e);
        }
    }
}
