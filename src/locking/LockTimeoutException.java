package locking;

public class LockTimeoutException extends Exception {
  public LockTimeoutException(String message) {
    super("Lock timeout: " + message);
  }
}
