/**
 * N+1 query detection on top of the statement event hook.
 *
 * @see io.datascope.diagnostics.StatementAnalyzer
 */
package io.datascope.diagnostics;
