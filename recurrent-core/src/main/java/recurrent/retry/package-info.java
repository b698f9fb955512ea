/**
 * Backoff policies applied when a recurring job's schedule cannot be computed.
 */
package recurrent.retry;
