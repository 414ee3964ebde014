package io.datascope;

/**
 * Thrown when a database URL uses a scheme with no registered dialect.
 */
public final class UnsupportedSchemeException extends IllegalArgumentException {
    private final String scheme;

    public UnsupportedSchemeException(String scheme, Iterable<String> supported) {
        super("Unsupported database URL scheme: " + scheme + ". Supported: " + supported);
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }
}
