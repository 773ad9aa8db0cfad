package com.incidentcommander.orchestrator.controller;

import com.incidentcommander.common.breaker.CircuitBreakerRegistry;
import com.incidentcommander.common.breaker.CircuitBreakerSnapshot;
import com.incidentcommander.common.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

/** Circuit breaker health of every agent role, with a manual reset for operators. */
@RestController
@RequestMapping("/api/v1/agents/circuit-breakers")
public class AgentHealthController {

    private static final Logger log = LoggerFactory.getLogger(AgentHealthController.class);

    private final CircuitBreakerRegistry breakers;

    public AgentHealthController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @GetMapping
    public List<CircuitBreakerSnapshot> all() {
        return Arrays.stream(AgentRole.values())
            .map(role -> breakers.forRole(role).snapshot())
            .toList();
    }

    @PostMapping("/{role}/reset")
    public CircuitBreakerSnapshot reset(@PathVariable AgentRole role) {
        breakers.reset(role);
        log.info("[CircuitBreaker] role={} reset by operator", role);
        return breakers.forRole(role).snapshot();
    }
}
