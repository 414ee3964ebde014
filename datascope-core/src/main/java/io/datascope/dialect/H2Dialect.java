package io.datascope.dialect;

import io.datascope.url.DatabaseUrl;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * H2 dialect. Primarily for testing and embedded use.
 *
 * <p>Embedded forms put the H2 locator in the path ({@code h2:///mem:orders},
 * {@code h2:///./data/orders}); a host selects server mode ({@code h2://db.local:9092/orders}).
 * Query parameters become H2 settings ({@code h2:///mem:orders?DB_CLOSE_DELAY=-1}).
 */
public final class H2Dialect extends AbstractDialect {
    private static final String MEM_PREFIX = "mem:";
    private static final String FILE_PREFIX = "file:";

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public String jdbcUrl(DatabaseUrl url) {
        String settings = url.query() == null ? "" : ";" + url.query().replace('&', ';');
        if (url.hasHost()) {
            return "jdbc:h2:tcp://" + serverLocation(url) + settings;
        }
        return "jdbc:h2:" + locator(url) + settings;
    }

    @Override
    public String r2dbcUrl(DatabaseUrl url) {
        String options = url.query() == null ? ""
            : "?options=" + URLEncoder.encode(url.query().replace('&', ';'), StandardCharsets.UTF_8);
        if (url.hasHost()) {
            return "r2dbc:h2:tcp://" + serverLocation(url) + options;
        }
        String locator = locator(url);
        if (locator.startsWith(MEM_PREFIX)) {
            return "r2dbc:h2:mem:///" + locator.substring(MEM_PREFIX.length()) + options;
        }
        if (locator.startsWith(FILE_PREFIX)) {
            locator = locator.substring(FILE_PREFIX.length());
        }
        return "r2dbc:h2:file:///" + locator + options;
    }

    @Override
    public String listTablesSql() {
        return "SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = 'PUBLIC' ORDER BY TABLE_NAME";
    }

    private String locator(DatabaseUrl url) {
        if (url.database() == null) {
            throw new IllegalArgumentException("h2 URL requires a database locator: " + url.toSafeString());
        }
        return url.database();
    }
}
