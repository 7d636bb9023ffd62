/**
 * Micrometer bridge for storedb transaction and query metrics.
 *
 * @see storedb.micrometer.MicrometerDatabaseMetrics
 */
package storedb.micrometer;
