package com.missionguard.infrastructure.upstream;

import com.missionguard.application.exceptions.UpstreamTimeoutException;
import com.missionguard.application.exceptions.UpstreamUnavailableException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link GenerativeGateway} calls on the gateway executor and stops waiting when
 * the caller's timeout expires, whatever the backend does.
 *
 * <p>An interrupted caller abandons the call; the pending future is cancelled.
 */
@Component
@Slf4j
public class TimeLimitedGateway {

    private final GenerativeGateway gateway;
    private final Executor gatewayExecutor;

    public TimeLimitedGateway(GenerativeGateway gateway, @Qualifier("gatewayExecutor") Executor gatewayExecutor) {
        this.gateway = gateway;
        this.gatewayExecutor = gatewayExecutor;
    }

    /**
     * @throws UpstreamTimeoutException when no answer arrives within {@code timeout}
     * @throws UpstreamUnavailableException on gateway failure, rejection or interruption
     */
    public String complete(String prompt, Duration timeout) {
        TimeLimiter limiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> gateway.complete(prompt, timeout), gatewayExecutor);
        } catch (RejectedExecutionException e) {
            throw new UpstreamUnavailableException(HttpGenerativeGateway.SOURCE, "gateway executor saturated", e);
        }
        try {
            return TimeLimiter.decorateFutureSupplier(limiter, () -> call).call();
        } catch (TimeoutException e) {
            throw new UpstreamTimeoutException(HttpGenerativeGateway.SOURCE, "no completion within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamUnavailableException upstream) {
                throw upstream;
            }
            throw new UpstreamUnavailableException(HttpGenerativeGateway.SOURCE,
                "completion failed: " + (cause != null ? cause.getMessage() : e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new UpstreamUnavailableException(HttpGenerativeGateway.SOURCE, "call abandoned", e);
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamUnavailableException(HttpGenerativeGateway.SOURCE, "completion failed: " + e.getMessage(), e);
        }
    }
}
