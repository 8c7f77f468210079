package com.aero.controller;

/**
 * Caller input that cannot be processed at all, answered with HTTP 400.
 */
public class MalformedRequestException extends RuntimeException {

    public MalformedRequestException(String message) {
        super(message);
    }
}
