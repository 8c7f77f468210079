package com.aero.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an NDJSON response stream.
 *
 * <p>A stream is {@code start}, zero or more {@code delta}, then exactly one {@code done}
 * carrying the final summary and provenance ({@code raw} and {@code attempts} are omitted).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamUpdate {

    public enum Type {
        START("start"),
        DELTA("delta"),
        DONE("done");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    private boolean ok;
    private Type type;
    private String delta;
    private GatewayData data;

    public static StreamUpdate start(String provider, boolean cached) {
        return StreamUpdate.builder()
                .ok(true)
                .type(Type.START)
                .data(GatewayData.builder().provider(provider).cached(cached).build())
                .build();
    }

    public static StreamUpdate delta(String text) {
        return StreamUpdate.builder()
                .ok(true)
                .type(Type.DELTA)
                .delta(text)
                .build();
    }

    public static StreamUpdate done(GatewayResult result) {
        GatewayEnvelope envelope = result.toEnvelope();
        return StreamUpdate.builder()
                .ok(envelope.isOk())
                .type(Type.DONE)
                .data(envelope.getData())
                .build();
    }
}
