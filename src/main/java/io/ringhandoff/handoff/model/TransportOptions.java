package io.ringhandoff.handoff.model;

import java.util.Map;

/**
 * Settings handed to an inbound transfer unit when it is started (TLS switch plus free-form properties).
 */
public record TransportOptions(boolean ssl, Map<String, String> properties) {

    private static final TransportOptions NONE = new TransportOptions(false, Map.of());

    public TransportOptions {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static TransportOptions none() {
        return NONE;
    }

    public String property(final String key) {
        return properties.get(key);
    }
}
