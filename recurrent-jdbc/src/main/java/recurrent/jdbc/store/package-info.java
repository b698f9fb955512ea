/**
 * JDBC persistence of recurring job definitions.
 */
package recurrent.jdbc.store;
