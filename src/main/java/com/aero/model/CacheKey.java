package com.aero.model;

import lombok.Value;

/**
 * Response cache key: provider id plus the prompt fingerprint.
 */
@Value
public class CacheKey {
    String providerId;
    String promptFingerprint;
}
