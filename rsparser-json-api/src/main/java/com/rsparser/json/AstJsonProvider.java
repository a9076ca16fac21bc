package com.rsparser.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point for JSON support. Implementations are found with {@link ServiceLoader}, so
 * putting a provider jar such as rsparser-jackson on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(Parser.parseFile(source));
 * SourceFile file = provider.getDeserializer().deserializeFile(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * A short name such as "Jackson", matched case-insensitively by {@link #getProvider(String)}.
     */
    String getName();

    /**
     * The first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            AstJsonProvider provider = iterator.next();
            Holder.log.debug("Using AST JSON provider {}", provider.getName());
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add rsparser-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * The provider called {@code name}.
     *
     * @throws IllegalStateException if no provider on the classpath has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
            Holder.log.trace("Skipping AST JSON provider {} while looking for {}", provider.getName(), name);
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider jar is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }

    /** Logger for the static lookups. */
    final class Holder {
        private static final Logger log = LoggerFactory.getLogger(AstJsonProvider.class);

        private Holder() {
        }
    }
}
