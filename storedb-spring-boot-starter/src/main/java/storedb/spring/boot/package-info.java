/**
 * Spring Boot auto-configuration for storedb.
 *
 * <p>{@link storedb.spring.boot.StoreDbAutoConfiguration} exposes a
 * {@link storedb.Database} over the application's data source;
 * {@link storedb.spring.boot.StoreDbMicrometerAutoConfiguration} exports its metrics.
 */
package storedb.spring.boot;
