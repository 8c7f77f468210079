package com.aero.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a gateway call.
 *
 * <p>Callers can tell a true success from a masked provider failure without relying on
 * exceptions: {@link Status#DEGRADED} still renders as {@code ok:true} on the wire but
 * carries the reason, while {@link Status#HARD_ERROR} is reserved for unusable caller input.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GatewayResult {

    public enum Status {
        SUCCESS,
        DEGRADED,
        HARD_ERROR
    }

    private final Status status;
    private final GatewayData data;
    private final GatewayErrorKind errorKind;
    private final String message;

    public static GatewayResult success(GatewayData data) {
        return new GatewayResult(Status.SUCCESS, data, null, null);
    }

    public static GatewayResult degraded(GatewayData data, GatewayErrorKind reason) {
        GatewayData marked = data.toBuilder()
                .degraded(true)
                .reason(reason)
                .build();
        return new GatewayResult(Status.DEGRADED, marked, reason, marked.getSummary());
    }

    public static GatewayResult hardError(GatewayErrorKind kind, String message) {
        return new GatewayResult(Status.HARD_ERROR, null, kind, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public GatewayEnvelope toEnvelope() {
        if (status == Status.HARD_ERROR) {
            return GatewayEnvelope.failure(errorKind, message);
        }
        return GatewayEnvelope.success(data);
    }
}
