package io.datascope.diagnostics;

import java.util.Locale;

/**
 * Coarse statement classification by leading keyword.
 */
public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    UNKNOWN;

    /**
     * Classifies normalized statement text. Never throws; blank or unrecognized text is
     * {@link #UNKNOWN}.
     */
    public static StatementKind infer(String normalizedSql) {
        if (normalizedSql == null || normalizedSql.isEmpty()) {
            return UNKNOWN;
        }
        int end = 0;
        while (end < normalizedSql.length() && Character.isLetter(normalizedSql.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return UNKNOWN;
        }
        switch (normalizedSql.substring(0, end).toUpperCase(Locale.ROOT)) {
            case "SELECT":
                return SELECT;
            case "INSERT":
                return INSERT;
            case "UPDATE":
                return UPDATE;
            case "DELETE":
                return DELETE;
            default:
                return UNKNOWN;
        }
    }
}
