package io.datascope.url;

import io.datascope.dialect.Dialects;
import io.datascope.spi.Dialect;

import java.util.Objects;

/**
 * Maps a blocking-mode connection string to its non-blocking equivalent and back.
 *
 * <p>Only the scheme segment is rewritten; credentials, host, path and query pass through
 * byte-for-byte:
 * <pre>{@code
 * UriTranslator.toNonBlocking("sqlite:///x.db")                 // sqlite+r2dbc:///x.db
 * UriTranslator.toNonBlocking("postgresql+jdbc://u:p@h/db")     // postgresql+r2dbc://u:p@h/db
 * UriTranslator.toNonBlocking("postgresql+r2dbc://u:p@h/db")    // unchanged
 * UriTranslator.toNonBlocking("ftp://host/file")                // UnsupportedSchemeException
 * }</pre>
 *
 * <p>The family table comes from the registered {@link Dialect}s.
 */
public final class UriTranslator {
    private static final String SEPARATOR = "://";

    private UriTranslator() {
    }

    /**
     * Rewrites the scheme to {@code family+<non-blocking driver>}. A URI that already names
     * the non-blocking driver is returned unchanged.
     *
     * @throws io.datascope.UnsupportedSchemeException if the family has no dialect
     * @throws IllegalArgumentException if the text has no {@code scheme://} prefix
     */
    public static String toNonBlocking(String uri) {
        int sep = schemeEnd(uri);
        String family = family(uri.substring(0, sep));
        Dialect dialect = Dialects.get(family);
        String target = family + "+" + dialect.nonBlockingDriver();
        if (uri.substring(0, sep).equals(target)) {
            return uri;
        }
        return target + uri.substring(sep);
    }

    /**
     * Strips any driver suffix, leaving the plain family scheme.
     *
     * @throws io.datascope.UnsupportedSchemeException if the family has no dialect
     * @throws IllegalArgumentException if the text has no {@code scheme://} prefix
     */
    public static String toBlocking(String uri) {
        int sep = schemeEnd(uri);
        String family = family(uri.substring(0, sep));
        Dialects.get(family);
        return family + uri.substring(sep);
    }

    private static int schemeEnd(String uri) {
        Objects.requireNonNull(uri, "uri");
        int sep = uri.indexOf(SEPARATOR);
        if (sep <= 0) {
            throw new IllegalArgumentException("Malformed database URL, expected scheme://...: " + DatabaseUrl.mask(uri));
        }
        return sep;
    }

    private static String family(String scheme) {
        int plus = scheme.indexOf('+');
        return plus < 0 ? scheme : scheme.substring(0, plus);
    }
}
