/**
 * Service Provider Interfaces (SPI) for plugging storedb into an application.
 *
 * <p>Integrators implement these to supply connections and to export metrics.
 *
 * @see storedb.spi.ConnectionProvider
 * @see storedb.spi.DatabaseMetrics
 */
package storedb.spi;
