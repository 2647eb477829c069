package io.ringhandoff.config.type;

import io.ringhandoff.config.impl.HandoffConfig;
import io.ringhandoff.handoff.transfer.TransferTaskProvider;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.util.Map;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads node configuration from a YAML file by delegating to {@link HandoffConfig#load(String)}.
     *
     * @param path the path to the handoff YAML configuration file
     * @return a populated {@link HandoffConfig} instance
     * @throws IOException if the file cannot be read or parsed
     */
    public static HandoffConfig load(final String path) throws IOException {
        return HandoffConfig.load(path);
    }

    /**
     * Instantiates the configured {@link TransferTaskProvider}.
     * <p>
     * A public constructor taking the {@code transferSettings} map is preferred; a public no-arg
     * constructor is used otherwise.
     *
     * @throws IllegalArgumentException if the class is missing, is not a provider, or cannot be built
     */
    public static TransferTaskProvider loadTransferProvider(final HandoffConfig cfg) {
        final String className = cfg.getTransferProvider();
        try {
            final Class<?> type = Class.forName(className);
            if (!TransferTaskProvider.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not implement " + TransferTaskProvider.class.getName());
            }
            try {
                final Constructor<?> withSettings = type.getConstructor(Map.class);
                return (TransferTaskProvider) withSettings.newInstance(cfg.getTransferSettings());
            } catch (final NoSuchMethodException e) {
                return (TransferTaskProvider) type.getConstructor().newInstance();
            }
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate transfer provider " + className, e);
        }
    }
}
