package booking;

/** The slot is not registered or has no tables left. */
public class SlotUnavailableException extends BookingException {
  public SlotUnavailableException(String message) {
    super(message);
  }
}
