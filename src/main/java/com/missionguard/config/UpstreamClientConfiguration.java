package com.missionguard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One {@link RestTemplate} per upstream collaborator: knowledge graph, dataset profiles,
 * generative gateway and the mission service.
 */
@Configuration
@Slf4j
public class UpstreamClientConfiguration {

    private final EngineProperties.Upstream upstream;

    public UpstreamClientConfiguration(EngineProperties properties) {
        this.upstream = properties.getUpstream();
    }

    @Bean
    public RestTemplate kgRestTemplate(RestTemplateBuilder builder) {
        return build(builder, "kg", upstream.getKg(), upstream.getFetchTimeout());
    }

    @Bean
    public RestTemplate profilesRestTemplate(RestTemplateBuilder builder) {
        return build(builder, "profiles", upstream.getProfiles(), upstream.getFetchTimeout());
    }

    /**
     * The socket read timeout is a backstop; per-section timeouts are enforced by the
     * synthesis time limiter and are usually shorter.
     */
    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, EngineProperties properties) {
        Duration readTimeout = properties.getSynthesis().getReportDeadline();
        return build(builder, "gateway", upstream.getGateway(), readTimeout);
    }

    @Bean
    public RestTemplate missionsRestTemplate(RestTemplateBuilder builder) {
        return build(builder, "missions", upstream.getMissions(), upstream.getFetchTimeout());
    }

    private RestTemplate build(RestTemplateBuilder builder, String name,
                               EngineProperties.Endpoint endpoint, Duration readTimeout) {
        log.info("Configuring {} client for {}", name, endpoint.getBaseUrl());
        RestTemplateBuilder configured = builder
            .rootUri(endpoint.getBaseUrl())
            .setConnectTimeout(upstream.getConnectTimeout())
            .setReadTimeout(readTimeout);
        if (StringUtils.hasText(endpoint.getApiKey())) {
            String apiKey = endpoint.getApiKey();
            ClientHttpRequestInterceptor auth = (request, body, execution) -> {
                request.getHeaders().setBearerAuth(apiKey);
                return execution.execute(request, body);
            };
            configured = configured.additionalInterceptors(auth);
        }
        return configured.build();
    }
}
