package com.incidentcommander.analysis;

import com.incidentcommander.analysis.agent.AgentReport;
import com.incidentcommander.analysis.agent.AnalysisAgent;
import com.incidentcommander.analysis.agent.AnalysisContext;
import com.incidentcommander.common.model.AgentRole;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Scriptable agent for harness and dispatch tests; counts invocations. */
public class StubAgent implements AnalysisAgent {

    private final AgentRole role;
    private final Function<Integer, AgentReport> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    /** @param behaviour receives the 1-based call number */
    public StubAgent(AgentRole role, Function<Integer, AgentReport> behaviour) {
        this.role = role;
        this.behaviour = behaviour;
    }

    public static StubAgent answering(AgentRole role, double confidence, String action) {
        return new StubAgent(role, n -> AgentReport.of(confidence, action, role + " stub", Map.of()));
    }

    public static StubAgent sleeping(AgentRole role, long millis, double confidence, String action) {
        return new StubAgent(role, n -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return AgentReport.of(confidence, action, role + " slow stub", Map.of());
        });
    }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        return behaviour.apply(calls.incrementAndGet());
    }

    @Override
    public AgentRole role() {
        return role;
    }

    public int calls() {
        return calls.get();
    }
}
