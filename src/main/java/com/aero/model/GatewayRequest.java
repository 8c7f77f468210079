package com.aero.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound generation request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayRequest {

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("providerId")
    @JsonAlias({"provider", "modelPick"})
    private String providerId;

    @JsonProperty("streaming")
    @JsonAlias("stream")
    private Boolean streaming;

    public boolean isStreamingRequested() {
        return Boolean.TRUE.equals(streaming);
    }
}
