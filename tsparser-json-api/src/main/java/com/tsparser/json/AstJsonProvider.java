package com.tsparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Pluggable JSON export for syntax trees. Implementations register themselves
 * in {@code META-INF/services/com.tsparser.json.AstJsonProvider} and are found
 * through {@link ServiceLoader}.
 *
 * <pre>{@code
 * Program program = Parser.parse("const answer = 42");
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
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
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add tsparser-jackson to your dependencies."
        );
    }

    /**
     * The provider whose {@link #getName()} matches, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
