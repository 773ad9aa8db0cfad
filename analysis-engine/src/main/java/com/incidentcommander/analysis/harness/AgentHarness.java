package com.incidentcommander.analysis.harness;

import com.incidentcommander.analysis.agent.AgentReport;
import com.incidentcommander.analysis.agent.AnalysisAgent;
import com.incidentcommander.analysis.agent.AnalysisContext;
import com.incidentcommander.common.breaker.AgentCircuitBreaker;
import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.DispatchOutcome;
import com.incidentcommander.common.model.FailureKind;
import com.incidentcommander.common.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs one agent call under a deadline and turns whatever happens into a
 * {@link DispatchOutcome}. The returned Mono never errors.
 *
 * <ul>
 *   <li>agent throws: retried up to {@code maxRetries} inside the same deadline, then {@code PROVIDER_ERROR}</li>
 *   <li>deadline elapses: {@code TIMEOUT}, not retried</li>
 *   <li>report fails {@link FindingValidator}: {@code INVALID_OUTPUT}, not retried</li>
 * </ul>
 * The final outcome, and only that, is reported to the role's circuit breaker.
 */
@Component
public class AgentHarness {

    private static final Logger log = LoggerFactory.getLogger(AgentHarness.class);

    private final CircuitBreakerRegistry breakers;
    private final Clock clock;

    public AgentHarness(CircuitBreakerRegistry breakers, Clock clock) {
        this.breakers = breakers;
        this.clock = clock;
    }

    public Mono<DispatchOutcome> invoke(AnalysisAgent agent, AgentDescriptor descriptor,
                                        AnalysisContext context, Duration deadline) {
        AgentRole role = descriptor.role();
        int round = context.round();
        String incidentId = context.incident().id();

        return Mono.fromCallable(() -> Optional.ofNullable(agent.analyze(context)))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.warn("[Harness] attempt failed incident={} role={} round={}: {}",
                                     incidentId, role, round, e.getMessage()))
            .retryWhen(Retry.max(descriptor.maxRetries()))
            .timeout(deadline)
            .map(report -> toOutcome(role, round, report.orElse(null)))
            .onErrorResume(e -> Mono.just(DispatchOutcome.failure(classify(role, round, e, deadline))))
            .doOnNext(outcome -> record(incidentId, outcome));
    }

    private DispatchOutcome toOutcome(AgentRole role, int round, AgentReport report) {
        Optional<String> violation = FindingValidator.violation(report);
        if (violation.isPresent()) {
            return DispatchOutcome.failure(
                new DispatchFailure(role, round, FailureKind.INVALID_OUTPUT, violation.get(), clock.instant()));
        }
        Finding finding = Finding.of(role, round, report.confidence(), report.recommendedAction(),
                                     report.summary(), report.evidence(), clock.instant());
        return DispatchOutcome.success(finding);
    }

    private DispatchFailure classify(AgentRole role, int round, Throwable error, Duration deadline) {
        if (error instanceof TimeoutException) {
            return new DispatchFailure(role, round, FailureKind.TIMEOUT,
                                       "no report within " + deadline.toMillis() + "ms", clock.instant());
        }
        Throwable cause = Exceptions.isRetryExhausted(error) && error.getCause() != null ? error.getCause() : error;
        return new DispatchFailure(role, round, FailureKind.PROVIDER_ERROR,
                                   cause.getClass().getSimpleName() + ": " + cause.getMessage(), clock.instant());
    }

    private void record(String incidentId, DispatchOutcome outcome) {
        AgentCircuitBreaker breaker = breakers.forRole(outcome.role());
        if (outcome.isSuccess()) {
            breaker.recordSuccess();
            log.info("[Harness] finding incident={} role={} action={} confidence={}",
                     incidentId, outcome.role(), outcome.finding().recommendedAction(),
                     String.format("%.3f", outcome.finding().confidence()));
        } else {
            breaker.recordFailure();
            log.warn("[Harness] dispatch failed incident={} role={} kind={} detail={}",
                     incidentId, outcome.role(), outcome.failure().kind(), outcome.failure().detail());
        }
    }
}
