package com.missionguard.infrastructure.upstream;

import com.missionguard.application.exceptions.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Completion client for the generative gateway. The timeout travels to the gateway as a
 * hint; callers still bound the wait on their side.
 */
@Component
@Slf4j
public class HttpGenerativeGateway implements GenerativeGateway {

    static final String SOURCE = "generative_gateway";

    private final RestTemplate gatewayRestTemplate;
    private final UpstreamCallSupport upstream;

    public HttpGenerativeGateway(
            @Qualifier("gatewayRestTemplate") RestTemplate gatewayRestTemplate,
            UpstreamCallSupport upstream) {
        this.gatewayRestTemplate = gatewayRestTemplate;
        this.upstream = upstream;
    }

    @Override
    public String complete(String prompt, Duration timeout) {
        CompletionRequest request = new CompletionRequest(prompt, timeout.toMillis());
        CompletionResponse response = upstream.call(SOURCE, () ->
            gatewayRestTemplate.postForObject("/v1/complete", request, CompletionResponse.class));
        if (response == null || response.text() == null || response.text().isBlank()) {
            throw new UpstreamUnavailableException(SOURCE, "empty completion");
        }
        return response.text();
    }

    record CompletionRequest(String prompt, long timeoutMs) {}

    record CompletionResponse(String text) {}
}
