/**
 * Micrometer metrics for the expiry sweeper and recurring job processor.
 *
 * @see recurrent.micrometer.MicrometerMetricsExporter
 */
package recurrent.micrometer;
