package rqc.queue;

import org.junit.jupiter.api.Test;
import rqc.stub.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInFlightTrackerTest {

  @Test
  void keyIsHeldUntilReleased() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();
    assertTrue(tracker.tryAcquire("J1:S1"));
    assertFalse(tracker.tryAcquire("J1:S1"));
    assertTrue(tracker.tryAcquire("J1:S2"));

    tracker.release("J1:S1");
    assertTrue(tracker.tryAcquire("J1:S1"));
    assertEquals(2, tracker.heldCount());
  }

  @Test
  void wedgedHolderIsDisplacedAfterMaxHold() {
    MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(5), clock);
    assertTrue(tracker.tryAcquire("J1:S1"));

    clock.advance(Duration.ofMinutes(5));
    assertFalse(tracker.tryAcquire("J1:S1"));

    clock.advance(Duration.ofSeconds(1));
    assertTrue(tracker.tryAcquire("J1:S1"));
    assertFalse(tracker.tryAcquire("J1:S1"));
  }

  @Test
  void rejectsNegativeMaxHold() {
    assertThrows(IllegalArgumentException.class,
        () -> new DefaultInFlightTracker(Duration.ofSeconds(-1), new MutableClock(Instant.EPOCH)));
  }
}
