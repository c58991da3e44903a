package com.openforge.gateway.routing;

import com.openforge.gateway.agent.AgentConfig;
import com.openforge.gateway.llm.model.CompletionRequest;
import com.openforge.gateway.resilience.BreakerStatus;
import com.openforge.gateway.resilience.FailoverBackend;

import java.util.List;

/**
 * Sends every request down one failover chain, with the shared cache,
 * ledger and agent defaults in front of it.
 */
public class FailoverRouter extends AbstractRouter {

    public static final String STRATEGY = "failover";

    private final FailoverBackend chain;

    public FailoverRouter(RouterContext context, FailoverBackend chain) {
        super(context);
        this.chain = chain;
    }

    @Override
    protected Route selectRoute(CompletionRequest request, AgentConfig agent) {
        return new Route(chain, request, false);
    }

    @Override
    public String strategy() {
        return STRATEGY;
    }

    @Override
    public List<String> backendIds() {
        return chain.breakerStatuses().stream().map(BreakerStatus::backendId).toList();
    }
}
