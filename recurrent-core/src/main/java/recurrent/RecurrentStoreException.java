package recurrent;

/**
 * Unchecked exception wrapping failures of the shared store (connectivity,
 * constraint violations, anything not classified as contention).
 *
 * <p>Components never recover from it locally; it propagates to the driver,
 * which owns retry policy.
 */
public final class RecurrentStoreException extends RuntimeException {
  public RecurrentStoreException(String message) {
    super(message);
  }

  public RecurrentStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
