package com.hecsink.transport;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Static entry point that resolves a {@link HecSenderProvider} from the class path. */
public final class HecSenders {
    private static final Logger log = LoggerFactory.getLogger(HecSenders.class);

    private HecSenders() {}

    /**
     * Validates {@code settings} and builds a sender with the first provider found.
     *
     * @throws InvalidSettingsException if token or collector URL is missing
     * @throws IllegalStateException if no provider is on the class path
     */
    public static HecSender create(HecTransportSettings settings) {
        Objects.requireNonNull(settings, "settings").requireComplete();
        return create(settings, HecSenders.class.getClassLoader());
    }

    static HecSender create(HecTransportSettings settings, ClassLoader classLoader) {
        Iterator<HecSenderProvider> providers =
                ServiceLoader.load(HecSenderProvider.class, classLoader).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("No " + HecSenderProvider.class.getName()
                    + " found on the class path; add hecsink-transport-okhttp");
        }
        HecSenderProvider provider = providers.next();
        log.debug("Using HEC transport provider '{}'", provider.name());
        return provider.create(settings);
    }
}
