package com.aero.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelope: {@code {ok, data}} on success, {@code {ok:false, error}} on a hard error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayEnvelope {

    private boolean ok;
    private GatewayData data;
    private ApiError error;

    public static GatewayEnvelope success(GatewayData data) {
        return GatewayEnvelope.builder().ok(true).data(data).build();
    }

    public static GatewayEnvelope failure(GatewayErrorKind kind, String message) {
        return GatewayEnvelope.builder().ok(false).error(new ApiError(kind, message)).build();
    }
}
