package com.incidentcommander.analysis.service;

import com.incidentcommander.analysis.agent.AnalysisAgent;
import com.incidentcommander.analysis.agent.AnalysisContext;
import com.incidentcommander.analysis.harness.AgentHarness;
import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.model.AgentDescriptor;
import com.incidentcommander.common.model.AgentRole;
import com.incidentcommander.common.model.DispatchOutcome;
import com.incidentcommander.common.model.Incident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fans one round out to every healthy, weighted agent concurrently and joins on the results.
 *
 * <p>The round deadline is the largest per-agent timeout, capped by the incident's remaining
 * budget, so round latency is bounded by the slowest agent rather than the sum.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);
    private static final Duration MIN_DEADLINE = Duration.ofMillis(1);

    private final Map<AgentRole, AnalysisAgent> agents = new EnumMap<>(AgentRole.class);
    private final AgentHarness harness;
    private final CircuitBreakerRegistry breakers;

    public AgentDispatchService(List<AnalysisAgent> agents, AgentHarness harness, CircuitBreakerRegistry breakers) {
        for (AnalysisAgent agent : agents) {
            if (this.agents.putIfAbsent(agent.role(), agent) != null) {
                throw new IllegalArgumentException("more than one agent registered for role " + agent.role());
            }
        }
        this.harness = harness;
        this.breakers = breakers;
    }

    /**
     * @param roster    descriptors of the incident's category; zero-weight roles are ignored
     * @param remaining time left in the incident's overall budget
     */
    public Mono<RoundResult> dispatchRound(Incident incident, int round, List<AgentDescriptor> roster,
                                           Duration remaining) {
        return dispatchRound(incident, round, roster, remaining, outcome -> { });
    }

    /**
     * As above; {@code onOutcome} sees each outcome as soon as its agent finishes, so a caller
     * can record partial results before the round joins.
     */
    public Mono<RoundResult> dispatchRound(Incident incident, int round, List<AgentDescriptor> roster,
                                           Duration remaining, Consumer<DispatchOutcome> onOutcome) {
        // breaker permission is taken at subscription, not at assembly
        return Mono.defer(() -> dispatch(incident, round, roster, remaining, onOutcome));
    }

    private Mono<RoundResult> dispatch(Incident incident, int round, List<AgentDescriptor> roster,
                                       Duration remaining, Consumer<DispatchOutcome> onOutcome) {
        List<AgentDescriptor> dispatched = new ArrayList<>();
        List<AgentRole> skipped = new ArrayList<>();
        for (AgentDescriptor descriptor : roster) {
            if (!descriptor.isActive()) continue;
            if (!agents.containsKey(descriptor.role())) {
                log.warn("[Dispatch] no agent registered for role={} incident={}", descriptor.role(), incident.id());
                continue;
            }
            if (breakers.forRole(descriptor.role()).tryAcquirePermission()) {
                dispatched.add(descriptor);
            } else {
                skipped.add(descriptor.role());
            }
        }

        Duration deadline = roundDeadline(dispatched, remaining);
        log.info("[Dispatch] incident={} round={} dispatching={} skipped(circuit open)={} deadline={}ms",
                 incident.id(), round, dispatched.stream().map(AgentDescriptor::role).toList(),
                 skipped, deadline.toMillis());

        AnalysisContext context = new AnalysisContext(incident, round);
        return Flux.fromIterable(dispatched)
            .flatMap(d -> harness.invoke(agents.get(d.role()), d, context, min(d.timeout(), deadline)))
            .doOnNext(onOutcome)
            .collectList()
            .map(outcomes -> new RoundResult(round, outcomes, skipped));
    }

    static Duration roundDeadline(List<AgentDescriptor> dispatched, Duration remaining) {
        Duration longest = dispatched.stream()
            .map(AgentDescriptor::timeout)
            .max(Duration::compareTo)
            .orElse(MIN_DEADLINE);
        Duration capped = min(longest, remaining);
        return capped.compareTo(MIN_DEADLINE) < 0 ? MIN_DEADLINE : capped;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
