package io.datascope.dialect;

import io.datascope.UnsupportedSchemeException;
import io.datascope.spi.Dialect;
import io.datascope.url.DatabaseUrl;

import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for database dialects keyed by URL family.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.datascope.spi.Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // By family name
 * Dialect dialect = Dialects.get("postgresql");
 *
 * // From a parsed URL
 * Dialect dialect = Dialects.forUrl(DatabaseUrl.parse("h2:///mem:orders"));
 *
 * // List all registered dialects
 * List<Dialect> all = Dialects.all();
 * }</pre>
 */
public final class Dialects {

    private static final List<Dialect> DIALECTS;
    private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

    static {
        DIALECTS = ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        for (Dialect dialect : DIALECTS) {
            BY_NAME.put(dialect.name().toLowerCase(), dialect);
        }
    }

    private Dialects() {
    }

    /**
     * Returns all registered dialects.
     */
    public static List<Dialect> all() {
        return DIALECTS;
    }

    /**
     * Gets a dialect by family name.
     *
     * @param family URL family (case-insensitive)
     * @return the dialect
     * @throws UnsupportedSchemeException if no dialect is registered for the family
     */
    public static Dialect get(String family) {
        Dialect dialect = BY_NAME.get(family.toLowerCase());
        if (dialect == null) {
            throw new UnsupportedSchemeException(family, BY_NAME.keySet());
        }
        return dialect;
    }

    /**
     * Resolves the dialect of a parsed URL.
     *
     * @throws UnsupportedSchemeException if the URL family is unknown
     */
    public static Dialect forUrl(DatabaseUrl url) {
        if (!BY_NAME.containsKey(url.family())) {
            throw new UnsupportedSchemeException(url.scheme(), BY_NAME.keySet());
        }
        return BY_NAME.get(url.family());
    }
}
