/**
 * Statement execution hook: engines publish a {@link io.datascope.event.StatementEvent}
 * after every statement a session executes.
 *
 * @see io.datascope.event.StatementEvents
 * @see io.datascope.diagnostics.StatementAnalyzer
 */
package io.datascope.event;
