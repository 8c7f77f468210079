package com.aero.model;

/**
 * Provenance headers set on gateway responses.
 */
public class GatewayHeaders {

    /**
     * Whether the summary came from the response cache.
     * Value: "true" or "false"
     */
    public static final String CACHE_HIT = "x-gateway-cache-hit";

    /**
     * Age of the cached entry in seconds (only on cache hits).
     */
    public static final String CACHE_AGE = "x-gateway-cache-age";

    /**
     * Provider id as requested by the caller.
     */
    public static final String PROVIDER = "x-gateway-provider";

    /**
     * Provider kind that actually produced the summary, when it differs from the request.
     */
    public static final String SERVED_BY = "x-gateway-served-by";

    /**
     * Present with value "true" when a provider failure was masked.
     */
    public static final String DEGRADED = "x-gateway-degraded";

    /**
     * Failure kind behind a degraded response, e.g. "rate_limited".
     */
    public static final String DEGRADED_REASON = "x-gateway-degraded-reason";

    private GatewayHeaders() {
    }
}
