package io.datascope.diagnostics;

/**
 * Work run inside {@link StatementAnalyzer#capture(String, CaptureBody)}.
 *
 * @param <T> result type
 * @param <X> checked exception the body may throw
 */
@FunctionalInterface
public interface CaptureBody<T, X extends Exception> {

    T run() throws X;
}
