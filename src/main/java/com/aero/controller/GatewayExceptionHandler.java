package com.aero.controller;

import com.aero.model.GatewayEnvelope;
import com.aero.model.GatewayErrorKind;
import com.aero.model.GatewayResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders unusable caller input as a 400 envelope.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(MalformedRequestException.class)
    public ResponseEntity<GatewayEnvelope> handleMalformedRequest(MalformedRequestException ex) {
        log.warn("Rejected malformed request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<GatewayEnvelope> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("Rejected unreadable request body: {}", ex.getReason());
        return badRequest("Request body is missing or is not valid JSON");
    }

    private ResponseEntity<GatewayEnvelope> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(GatewayResult.hardError(GatewayErrorKind.MALFORMED_REQUEST, message).toEnvelope());
    }
}
