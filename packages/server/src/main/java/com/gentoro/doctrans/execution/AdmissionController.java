package com.gentoro.doctrans.execution;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting semaphore that bounds how many tasks run the engine at once.
 *
 * <p>Admission is strictly FIFO by reservation: {@link #reserve} is called while the task is being
 * submitted, in creation order, and {@link #acquire} only admits the oldest waiting reservation.
 * A reservation that is abandoned must be withdrawn through {@link Ticket#close()}, otherwise it
 * would block everyone behind it.
 *
 * <pre>{@code
 * try (Ticket ticket = admission.reserve(taskId)) {
 *   try (Permit permit = admission.acquire(ticket)) {
 *     // at most capacity() threads are here
 *   }
 * }
 * }</pre>
 */
public final class AdmissionController {
  private final int capacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Deque<Ticket> waiting = new ArrayDeque<>();
  private int inUse;

  public AdmissionController(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Admission capacity must be at least 1: " + capacity);
    }
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }

  /** Slots currently held. */
  public int inUse() {
    lock.lock();
    try {
      return inUse;
    } finally {
      lock.unlock();
    }
  }

  /** Reservations not yet admitted. */
  public int waiting() {
    lock.lock();
    try {
      return waiting.size();
    } finally {
      lock.unlock();
    }
  }

  /** Take a place in the admission line. */
  public Ticket reserve(String taskId) {
    Ticket ticket = new Ticket(taskId);
    lock.lock();
    try {
      waiting.addLast(ticket);
    } finally {
      lock.unlock();
    }
    return ticket;
  }

  /**
   * Block until {@code ticket} is first in line and a slot is free. If interrupted while waiting,
   * the ticket is withdrawn.
   */
  public Permit acquire(Ticket ticket) throws InterruptedException {
    lock.lock();
    try {
      if (ticket.state != Ticket.State.WAITING) {
        throw new IllegalStateException("Ticket for task " + ticket.taskId + " is not waiting");
      }
      while (waiting.peekFirst() != ticket || inUse >= capacity) {
        changed.await();
      }
      waiting.removeFirst();
      ticket.state = Ticket.State.ADMITTED;
      inUse++;
      // the next ticket may also fit
      changed.signalAll();
      return new Permit();
    } catch (InterruptedException e) {
      withdrawLocked(ticket);
      throw e;
    } finally {
      lock.unlock();
    }
  }

  /** Reserve and wait in one step. */
  public Permit acquire(String taskId) throws InterruptedException {
    return acquire(reserve(taskId));
  }

  private void withdrawLocked(Ticket ticket) {
    if (ticket.state == Ticket.State.WAITING) {
      waiting.remove(ticket);
      ticket.state = Ticket.State.WITHDRAWN;
      changed.signalAll();
    }
  }

  private void release() {
    lock.lock();
    try {
      inUse--;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /** Place in the admission line. Closing it withdraws the reservation unless already admitted. */
  public final class Ticket implements AutoCloseable {
    private enum State {
      WAITING,
      ADMITTED,
      WITHDRAWN
    }

    private final String taskId;
    private State state = State.WAITING;

    private Ticket(String taskId) {
      this.taskId = taskId;
    }

    public String taskId() {
      return taskId;
    }

    @Override
    public void close() {
      lock.lock();
      try {
        withdrawLocked(this);
      } finally {
        lock.unlock();
      }
    }
  }

  /** A held slot. Closing it releases the slot exactly once. */
  public final class Permit implements AutoCloseable {
    private boolean released;

    private Permit() {}

    @Override
    public void close() {
      synchronized (this) {
        if (released) return;
        released = true;
      }
      release();
    }
  }
}
