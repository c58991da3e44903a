package com.openforge.gateway.agent;

/**
 * An agent's routing preference, consulted by the tier router.
 */
public enum ModelTier {

    /** Always served by the local backend. */
    LOCAL,

    /** Always served by a cloud backend. */
    CLOUD,

    /** Local or cloud depending on the request's complexity score. */
    HYBRID
}
