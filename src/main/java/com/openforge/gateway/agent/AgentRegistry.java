package com.openforge.gateway.agent;

import java.util.List;

/**
 * Source of per-agent configuration and admission control.
 *
 * The routing layer only reads from it; {@link #allow} is called by the HTTP
 * layer before a request reaches a router.
 */
public interface AgentRegistry {

    /** Never null: unknown ids get {@link AgentConfig#defaults}. */
    AgentConfig get(String agentId);

    /** Whether the agent may issue another request right now. */
    boolean allow(String agentId);

    /** Ids of all explicitly registered agents, sorted. */
    List<String> list();
}
