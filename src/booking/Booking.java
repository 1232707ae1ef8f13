package booking;

import java.time.Instant;
import java.util.UUID;

/** A confirmed table booking. Immutable. */
public final class Booking {
  private final UUID bookingId;
  private final String slotKey;
  private final int numPeople;
  private final String userId;
  private final Instant createdAt;

  public Booking(final String slotKey, final int numPeople, final String userId) {
    this.bookingId = UUID.randomUUID();
    this.slotKey = slotKey;
    this.numPeople = numPeople;
    this.userId = userId;
    this.createdAt = Instant.now();
  }

  public UUID getBookingId() {
    return bookingId;
  }

  public String getSlotKey() {
    return slotKey;
  }

  public int getNumPeople() {
    return numPeople;
  }

  public String getUserId() {
    return userId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return "Booking{"
        + bookingId
        + ", slot="
        + slotKey
        + ", people="
        + numPeople
        + ", user="
        + userId
        + ", at="
        + createdAt
        + "}";
  }
}
