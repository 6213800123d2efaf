package com.gentoro.doctrans.execution;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AdmissionControllerTest {

  @Test
  void rejectsCapacityBelowOne() {
    assertThrows(IllegalArgumentException.class, () -> new AdmissionController(0));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 5})
  void neverAdmitsMoreThanCapacity(int capacity) throws Exception {
    AdmissionController admission = new AdmissionController(capacity);
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    ExecutorService pool = Executors.newFixedThreadPool(12);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 24; i++) {
        String id = "t" + i;
        futures.add(
            pool.submit(
                () -> {
                  try (AdmissionController.Permit permit = admission.acquire(id)) {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(5);
                    running.decrementAndGet();
                  }
                  return null;
                }));
      }
      for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertTrue(peak.get() <= capacity, "peak " + peak.get());
    assertEquals(0, admission.inUse());
    assertEquals(0, admission.waiting());
  }

  @Test
  void admitsInReservationOrder() throws Exception {
    AdmissionController admission = new AdmissionController(1);
    AdmissionController.Permit held = admission.acquire("a");

    AdmissionController.Ticket b = admission.reserve("b");
    AdmissionController.Ticket c = admission.reserve("c");
    AdmissionController.Ticket d = admission.reserve("d");

    List<String> order = Collections.synchronizedList(new ArrayList<>());
    CountDownLatch done = new CountDownLatch(3);
    // waiters start in reverse order of their reservations
    for (AdmissionController.Ticket t : List.of(d, c, b)) {
      Thread waiter =
          new Thread(
              () -> {
                try (AdmissionController.Permit p = admission.acquire(t)) {
                  order.add(t.taskId());
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                } finally {
                  done.countDown();
                }
              });
      waiter.start();
    }
    Thread.sleep(50);
    assertTrue(order.isEmpty());

    held.close();
    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("b", "c", "d"), order);
  }

  @Test
  void withdrawnTicketDoesNotBlockTheLine() throws Exception {
    AdmissionController admission = new AdmissionController(1);
    AdmissionController.Permit held = admission.acquire("a");
    AdmissionController.Ticket b = admission.reserve("b");
    AdmissionController.Ticket c = admission.reserve("c");

    b.close();
    assertEquals(1, admission.waiting());
    held.close();

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<AdmissionController.Permit> permit = pool.submit(() -> admission.acquire(c));
      permit.get(2, TimeUnit.SECONDS).close();
    } finally {
      pool.shutdownNow();
    }
    assertThrows(IllegalStateException.class, () -> admission.acquire(b));
  }

  @Test
  void interruptedWaiterLeavesTheLine() throws Exception {
    AdmissionController admission = new AdmissionController(1);
    AdmissionController.Permit held = admission.acquire("a");
    CountDownLatch interrupted = new CountDownLatch(1);

    Thread waiter =
        new Thread(
            () -> {
              try {
                admission.acquire("b").close();
              } catch (InterruptedException e) {
                interrupted.countDown();
              }
            });
    waiter.start();
    while (admission.waiting() == 0) Thread.sleep(5);
    waiter.interrupt();

    assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    assertEquals(0, admission.waiting());
    held.close();
    assertEquals(0, admission.inUse());
  }

  @Test
  void permitReleasesOnlyOnce() throws Exception {
    AdmissionController admission = new AdmissionController(2);
    AdmissionController.Permit a = admission.acquire("a");
    AdmissionController.Permit b = admission.acquire("b");
    assertEquals(2, admission.inUse());

    a.close();
    a.close();
    assertEquals(1, admission.inUse());
    b.close();
    assertEquals(0, admission.inUse());
  }
}
