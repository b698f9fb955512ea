/**
 * Database-specific bounded deletes of expired records and superseded state history.
 *
 * @see recurrent.jdbc.purge.JdbcExpiryPurgers
 * @see recurrent.expiry.ExpirySweeper
 */
package recurrent.jdbc.purge;
