package io.ringhandoff.config.impl;

import io.ringhandoff.handoff.manager.HandoffManager;
import io.ringhandoff.handoff.transfer.impl.SimulatedTransferTaskProvider;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable config holder loaded from handoff.yaml
 */
@Getter
public final class HandoffConfig {

    public static final String CONCURRENCY_PROPERTY = "ringhandoff.handoffConcurrency";
    public static final String CONCURRENCY_ENV = "RINGHANDOFF_HANDOFF_CONCURRENCY";

    private int nodeId;
    private List<Integer> nodes;
    private int ringSize;
    private int replicationFactor;
    private int handoffConcurrency;
    private int adminPort;
    private String transferProvider;
    private Map<String, Object> transferSettings;

    @SuppressWarnings("unchecked")
    public static HandoffConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) {
                throw new IOException("Empty handoff config " + path);
            }
            final HandoffConfig cfg = new HandoffConfig();

            final Integer nodeId = (Integer) m.get("nodeId");
            if (nodeId == null) {
                throw new IllegalArgumentException("nodeId is required in " + path);
            }
            cfg.nodeId    = nodeId;
            cfg.nodes     = (List<Integer>) m.getOrDefault("nodes", List.of(cfg.nodeId));
            cfg.ringSize  = (Integer) m.getOrDefault("ringSize", 64);
            cfg.replicationFactor = (Integer) m.getOrDefault("replicationFactor", 3);
            cfg.adminPort = (Integer) m.getOrDefault("adminPort", 9190);

            cfg.handoffConcurrency = concurrencyOverride()
                    .orElse((Integer) m.getOrDefault("handoffConcurrency", HandoffManager.DEFAULT_CONCURRENCY));
            if (cfg.handoffConcurrency < 0) {
                throw new IllegalArgumentException("handoffConcurrency must be >= 0");
            }

            cfg.transferProvider = (String) m.getOrDefault("transferProvider",
                    SimulatedTransferTaskProvider.class.getName());
            cfg.transferSettings = settings((Map<String, Object>) m.get("transferSettings"));

            if (!cfg.nodes.contains(cfg.nodeId)) {
                throw new IllegalArgumentException("nodes " + cfg.nodes + " must include nodeId " + cfg.nodeId);
            }
            return cfg;
        }
    }

    /** Entries without a value are dropped. */
    private static Map<String, Object> settings(final Map<String, Object> raw) {
        if (raw == null) return Map.of();
        final Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, v);
        });
        return Map.copyOf(out);
    }

    private static Optional<Integer> concurrencyOverride() {
        final String property = System.getProperty(CONCURRENCY_PROPERTY);
        final String name = property != null ? CONCURRENCY_PROPERTY : CONCURRENCY_ENV;
        final String v = property != null ? property : System.getenv(CONCURRENCY_ENV);
        if (v == null || v.isBlank()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(v.trim()));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + v + "'", e);
        }
    }
}
