package com.scholary.songgen.job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * FIFO of job ids waiting for the worker.
 *
 * <p>Unlike a plain {@link java.util.concurrent.BlockingQueue} this also answers "how many jobs are
 * ahead of X", which the status endpoint reports as the queue position. The queue lives in memory
 * only; ids pending at shutdown are not re-enqueued on restart.
 */
@Component
public class JobQueue {

  private final Deque<String> pending = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();

  /**
   * Appends a job id.
   *
   * @return number of jobs ahead of this one
   */
  public int enqueue(String jobId) {
    lock.lock();
    try {
      int position = pending.size();
      pending.addLast(jobId);
      notEmpty.signal();
      return position;
    } finally {
      lock.unlock();
    }
  }

  /** Removes and returns the oldest id, waiting until one is available. */
  public String take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (pending.isEmpty()) {
        notEmpty.await();
      }
      return pending.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /** Zero-based position of a pending job, empty if it is not waiting. */
  public OptionalInt position(String jobId) {
    lock.lock();
    try {
      int index = 0;
      for (String id : pending) {
        if (id.equals(jobId)) {
          return OptionalInt.of(index);
        }
        index++;
      }
      return OptionalInt.empty();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  public List<String> pendingIds() {
    lock.lock();
    try {
      return new ArrayList<>(pending);
    } finally {
      lock.unlock();
    }
  }
}
