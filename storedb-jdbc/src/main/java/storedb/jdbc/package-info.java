/**
 * JDBC implementation of the storedb API.
 *
 * <p>{@link storedb.jdbc.TransactionExecutor} holds the conflict retry loop;
 * {@link storedb.jdbc.JdbcDatabase} is the facade that adds direct queries, slow-query
 * logging, server metadata and pool statistics on top of it.
 *
 * @see storedb.jdbc.TransactionExecutor
 * @see storedb.jdbc.JdbcDatabase
 * @see storedb.jdbc.SqlStateConflictClassifier
 */
package storedb.jdbc;
