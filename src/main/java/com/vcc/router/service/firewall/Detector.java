package com.vcc.router.service.firewall;

/**
 * Deterministic output detector. Implementations are stateless and thread-safe.
 */
public interface Detector {

    String name();

    DetectionResult scan(String text);
}
