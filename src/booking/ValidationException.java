package booking;

public class ValidationException extends BookingException {
  public ValidationException(String message) {
    super(message);
  }
}
