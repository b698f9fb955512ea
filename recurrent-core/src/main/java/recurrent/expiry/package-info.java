/**
 * Periodic removal of expired records from the shared store.
 *
 * <p>{@link recurrent.expiry.ExpirySweeper} sweeps each {@link recurrent.expiry.ExpiryCategory}
 * in bounded batches under a distributed lock, so many servers can run it against one store.
 *
 * @see recurrent.spi.ExpiryPurger
 */
package recurrent.expiry;
