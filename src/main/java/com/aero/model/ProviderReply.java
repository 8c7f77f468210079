package com.aero.model;

import com.aero.provider.ProviderKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Successful reply of a provider strategy, already normalized to plain summary text.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderReply {
    private String summary;
    private JsonNode raw;
    private ProviderKind servedBy;
    private int attempts;
}
