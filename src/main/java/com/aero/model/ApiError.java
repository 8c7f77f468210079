package com.aero.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of a non-success envelope.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private GatewayErrorKind kind;
    private String message;
}
