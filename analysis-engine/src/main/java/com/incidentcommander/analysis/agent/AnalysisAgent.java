package com.incidentcommander.analysis.agent;

import com.incidentcommander.common.model.AgentRole;

/**
 * One specialized analysis unit. Implementations may block and may throw; the harness runs
 * them off the event loop, bounds them with a deadline and validates what they return.
 */
public interface AnalysisAgent {

    AgentReport analyze(AnalysisContext context);

    AgentRole role();
}
