package booking;

/** Base of every failure raised by SlotBookingService. */
public class BookingException extends Exception {
  public BookingException(String message) {
    super("Booking error: " + message);
  }

  public BookingException(String message, Throwable cause) {
    super("Booking error: " + message, cause);
  }
}
