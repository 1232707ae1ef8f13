package booking;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import locking.KeyLock;
import locking.KeyLockRegistry;
import locking.LockTimeoutException;
import org.apache.log4j.Logger;

/**
 * Books tables per time slot. Checking availability, taking a table and recording the booking
 * happen under the slot's lock, so concurrent bookings of one slot never oversell it while
 * bookings of other slots proceed in parallel.
 */
public class SlotBookingService {
  public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 5000;
  private static final Logger logger = Logger.getLogger(SlotBookingService.class);
  private final ConcurrentHashMap<String, Integer> availability = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Booking> bookings = new ConcurrentHashMap<>();
  private final KeyLockRegistry<String> slotLocks;
  private final long lockTimeout;
  private final TimeUnit lockTimeoutUnit;

  public SlotBookingService() {
    this(new KeyLockRegistry<>(), DEFAULT_LOCK_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
  }

  /**
   * @param slotLocks The registry holding one lock per slot key.
   * @param lockTimeout How long a booking waits for its slot before giving up.
   * @param lockTimeoutUnit The unit of lockTimeout.
   */
  public SlotBookingService(
      final KeyLockRegistry<String> slotLocks,
      final long lockTimeout,
      final TimeUnit lockTimeoutUnit) {
    this.slotLocks = slotLocks;
    this.lockTimeout = lockTimeout;
    this.lockTimeoutUnit = lockTimeoutUnit;
  }

  /**
   * Register a slot, or reset its table count.
   *
   * @param slotKey The slot to configure.
   * @param tables The number of tables available in the slot.
   * @throws ValidationException if tables is negative.
   * @throws BookingException if the slot is contended for longer than the lock timeout.
   */
  public void setTimeSlot(final String slotKey, final int tables) throws BookingException {
    if (tables < 0) {
      throw new ValidationException("tables must be >= 0. Given: " + tables);
    }
    try (KeyLock<String> ignored = lockSlot(slotKey)) {
      availability.put(slotKey, tables);
    }
    logger.info("Slot " + slotKey + " set to " + tables + " tables");
  }

  /** @return The tables left in slotKey, 0 if the slot is not registered. */
  public int availableTables(final String slotKey) {
    return availability.getOrDefault(slotKey, 0);
  }

  /**
   * Take one table in slotKey for userId.
   *
   * @return The recorded booking.
   * @throws ValidationException if numPeople is not positive.
   * @throws SlotUnavailableException if the slot is unknown or full.
   * @throws BookingException if the slot lock could not be acquired in time. Nothing is changed.
   */
  public Booking bookTable(final String userId, final String slotKey, final int numPeople)
      throws BookingException {
    if (numPeople <= 0) {
      throw new ValidationException("numPeople must be > 0. Given: " + numPeople);
    }
    try (KeyLock<String> ignored = lockSlot(slotKey)) {
      Integer tables = availability.get(slotKey);
      if (tables == null) {
        throw new SlotUnavailableException("Slot " + slotKey + " not registered");
      }
      if (tables <= 0) {
        throw new SlotUnavailableException("No tables available in slot " + slotKey);
      }
      availability.put(slotKey, tables - 1);
      Booking booking = new Booking(slotKey, numPeople, userId);
      bookings.put(booking.getBookingId().toString(), booking);
      logger.info("Booked " + booking);
      return booking;
    }
  }

  public List<Booking> listBookings() {
    return new ArrayList<>(bookings.values());
  }

  private KeyLock<String> lockSlot(final String slotKey) throws BookingException {
    try {
      return slotLocks.acquire(slotKey, lockTimeout, lockTimeoutUnit);
    } catch (LockTimeoutException e) {
      throw new BookingException("Could not acquire lock for " + slotKey + ", try again", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BookingException("Interrupted while waiting for slot " + slotKey, e);
    }
  }
}
