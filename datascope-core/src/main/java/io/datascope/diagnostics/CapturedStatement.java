package io.datascope.diagnostics;

import java.util.List;

/**
 * One statement recorded during a capture window.
 *
 * @param index      zero-based position in execution order
 * @param text       statement with surrounding whitespace trimmed and inner runs collapsed
 * @param kind       leading-keyword classification
 * @param parameters bound parameters, as published by the session
 */
public record CapturedStatement(int index, String text, StatementKind kind, List<Object> parameters) {
}
