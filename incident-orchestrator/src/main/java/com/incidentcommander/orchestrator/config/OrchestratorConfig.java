package com.incidentcommander.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.incidentcommander.common.breaker.CircuitBreakerConfig;
import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.consensus.ConsensusEngine;
import com.incidentcommander.common.consensus.WeightedConsensusStrategy;
import com.incidentcommander.orchestrator.policy.CategoryPolicyRegistry;
import com.incidentcommander.orchestrator.policy.ResolutionSettings;
import com.incidentcommander.orchestrator.remediation.DryRunRemediationExecutor;
import com.incidentcommander.orchestrator.remediation.RemediationExecutor;
import com.incidentcommander.orchestrator.remediation.RestRemediationExecutor;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(IncidentCommanderProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.remediation.base-url:http://localhost:8090}")
    private String remediationUrl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new WeightedConsensusStrategy();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(IncidentCommanderProperties properties, Clock clock) {
        IncidentCommanderProperties.CircuitBreakerProperties breaker = properties.getCircuitBreaker();
        return new CircuitBreakerRegistry(
            new CircuitBreakerConfig(breaker.getFailureThreshold(), breaker.getCooldown()), clock);
    }

    @Bean
    public CategoryPolicyRegistry categoryPolicyRegistry(IncidentCommanderProperties properties) {
        return new CategoryPolicyRegistry(properties);
    }

    @Bean
    public ResolutionSettings resolutionSettings(IncidentCommanderProperties properties) {
        IncidentCommanderProperties.ResolutionProperties resolution = properties.getResolution();
        return new ResolutionSettings(resolution.getMaxRounds(), resolution.getRetryMargin(),
                                      resolution.getIncidentTimeout(), resolution.getExecutionTimeout(),
                                      Set.copyOf(resolution.getRequiresApprovalActions()));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public WebClient remediationClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(10))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(10, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(remediationUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public RemediationExecutor remediationExecutor(IncidentCommanderProperties properties, WebClient remediationClient) {
        IncidentCommanderProperties.RemediationProperties remediation = properties.getRemediation();
        if ("rest".equalsIgnoreCase(remediation.getMode())) {
            log.info("[Remediation] mode=rest endpoint={}", remediationUrl);
            return new RestRemediationExecutor(remediationClient);
        }
        if (!"dry-run".equalsIgnoreCase(remediation.getMode())) {
            throw new IllegalArgumentException("unknown remediation mode: " + remediation.getMode());
        }
        log.info("[Remediation] mode=dry-run failingActions={}", remediation.getFailingActions());
        return new DryRunRemediationExecutor(Set.copyOf(remediation.getFailingActions()));
    }
}
