package com.godzilla.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for AST JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., godzilla-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * File file = provider.getDeserializer().deserializeFile(json);
 * String source = file.toSource();
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available AstJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add godzilla-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets an AstJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
