package com.aero.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized result payload, identical for every provider.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayData {

    private String summary;

    /**
     * Provider id as requested by the caller (or the default id when none was given).
     */
    private String provider;

    /**
     * Unmodified provider response body, when one was received.
     */
    private JsonNode raw;

    private boolean cached;

    /**
     * Present and true only when the summary is a stand-in for a failed provider call.
     */
    private Boolean degraded;

    private GatewayErrorKind reason;

    /**
     * Outbound attempts made for this result, retries included.
     */
    private Integer attempts;

    /**
     * Provider that actually served the request, when it differs from {@link #provider}.
     */
    private String servedBy;

    private Long cacheAgeSeconds;
}
