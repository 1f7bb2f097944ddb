package com.cellparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * A JSON backend for cell ASTs. Implementations are discovered with
 * {@link ServiceLoader}; putting {@code cellparser-jackson} on the class
 * path is enough to make one available.
 *
 * <pre>{@code
 * Cell cell = CellParsing.parseCell("x = FileAttachment(\"a.csv\")");
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(cell);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * A short name such as "Jackson".
     */
    String getName();

    /**
     * Returns the first provider on the class path.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add cellparser-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Returns the provider with the given name, ignoring case.
     *
     * @throws IllegalStateException if no such provider is on the class path
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
