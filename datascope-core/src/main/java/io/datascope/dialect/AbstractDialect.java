package io.datascope.dialect;

import io.datascope.spi.Dialect;
import io.datascope.url.DatabaseUrl;

/**
 * Base dialect for client/server databases reachable at {@code host[:port]/database}.
 *
 * <p>Subclasses can override methods to handle embedded or vendor-specific URL shapes.
 */
public abstract class AbstractDialect implements Dialect {

    @Override
    public String jdbcUrl(DatabaseUrl url) {
        return "jdbc:" + name() + "://" + serverLocation(url) + querySuffix(url);
    }

    @Override
    public String r2dbcUrl(DatabaseUrl url) {
        return "r2dbc:" + name() + "://" + serverLocation(url) + querySuffix(url);
    }

    protected String serverLocation(DatabaseUrl url) {
        if (!url.hasHost()) {
            throw new IllegalArgumentException(name() + " URL requires a host: " + url.toSafeString());
        }
        if (url.database() == null) {
            throw new IllegalArgumentException(name() + " URL requires a database: " + url.toSafeString());
        }
        return url.hostAndPort() + "/" + url.database();
    }

    protected static String querySuffix(DatabaseUrl url) {
        return url.query() == null ? "" : "?" + url.query();
    }
}
