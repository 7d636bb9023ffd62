/**
 * Public API: capability interfaces ({@link storedb.Transactor}, {@link storedb.QueryRunner},
 * {@link storedb.MetadataSource}, {@link storedb.Database}), transaction options and the
 * retry policy.
 *
 * @see storedb.Transactor
 * @see storedb.TxOption
 * @see storedb.RetryPolicy
 * @see storedb.ConflictClassifier
 */
package storedb;
