/**
 * Connection string model and the blocking/non-blocking scheme translation.
 */
package io.datascope.url;
