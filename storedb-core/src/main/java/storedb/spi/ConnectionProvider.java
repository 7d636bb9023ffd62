package storedb.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides pooled JDBC connections to the transaction executor and the
 * direct query methods of the database facade.
 *
 * <p>Callers are responsible for closing the returned connection, which hands it
 * back to the pool.
 *
 * @see storedb.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Borrows a JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
