package com.missionguard.infrastructure.upstream;

import com.missionguard.application.exceptions.UpstreamTimeoutException;
import com.missionguard.application.exceptions.UpstreamUnavailableException;
import com.missionguard.config.EngineProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.util.function.Supplier;

/**
 * Retry and error translation shared by the HTTP adapters.
 *
 * <p>Retries 429 and 5xx responses and I/O failures with exponential backoff capped
 * at {@code engine.upstream.max-retry-delay}; other 4xx responses fail at once.
 * Every failure leaves as {@link UpstreamUnavailableException} or
 * {@link UpstreamTimeoutException}.
 */
@Component
@Slf4j
public class UpstreamCallSupport {

    private final RetryConfig retryConfig;

    public UpstreamCallSupport(EngineProperties properties) {
        EngineProperties.Upstream upstream = properties.getUpstream();
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(upstream.getMaxRetries() + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                upstream.getRetryDelay(), 2.0, upstream.getMaxRetryDelay()))
            .retryOnException(UpstreamCallSupport::isRetryable)
            .build();
    }

    public <T> T call(String source, Supplier<T> request) {
        Retry retry = Retry.of(source, retryConfig);
        retry.getEventPublisher().onRetry(event ->
            log.warn("Upstream {} failed (attempt {}), retrying in {}: {}",
                source, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        try {
            return Retry.decorateSupplier(retry, request).get();
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new UpstreamTimeoutException(source, "timed out", e);
            }
            throw new UpstreamUnavailableException(source, "connection failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException(source, "request failed: " + e.getMessage(), e);
        }
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof HttpClientErrorException.TooManyRequests) {
            return true;
        }
        return t instanceof HttpServerErrorException || t instanceof ResourceAccessException;
    }
}
