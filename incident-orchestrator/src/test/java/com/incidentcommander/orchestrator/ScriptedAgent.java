package com.incidentcommander.orchestrator;

import com.incidentcommander.analysis.agent.AgentReport;
import com.incidentcommander.analysis.agent.AnalysisAgent;
import com.incidentcommander.analysis.agent.AnalysisContext;
import com.incidentcommander.common.exception.AgentException;
import com.incidentcommander.common.model.AgentRole;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Agent with a fixed script keyed by round, for end-to-end orchestration tests. */
public class ScriptedAgent implements AnalysisAgent {

    private final AgentRole role;
    private final Function<Integer, AgentReport> byRound;
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedAgent(AgentRole role, Function<Integer, AgentReport> byRound) {
        this.role = role;
        this.byRound = byRound;
    }

    public static ScriptedAgent answering(AgentRole role, double confidence, String action) {
        return new ScriptedAgent(role, round -> AgentReport.of(confidence, action, role + " scripted", Map.of()));
    }

    public static ScriptedAgent failing(AgentRole role) {
        return new ScriptedAgent(role, round -> {
            throw new AgentException(role, "scripted outage");
        });
    }

    /** Answers only after {@code delay}, or fails if interrupted first. */
    public static ScriptedAgent stalling(AgentRole role, Duration delay, double confidence, String action) {
        return new ScriptedAgent(role, round -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentException(role, "interrupted while stalling");
            }
            return AgentReport.of(confidence, action, role + " scripted", Map.of());
        });
    }

    @Override
    public AgentReport analyze(AnalysisContext context) {
        calls.incrementAndGet();
        return byRound.apply(context.round());
    }

    @Override
    public AgentRole role() {
        return role;
    }

    public int calls() {
        return calls.get();
    }
}
