package com.mmwave.zone_configurator.support;

import com.mmwave.zone_configurator.transport.TransportTimers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class ManualTransportTimers implements TransportTimers {

  private final List<ManualHandle> handles = new ArrayList<>();
  private Duration now = Duration.ZERO;
  private long sequence;

  @Override
  public synchronized TimerHandle schedule(Duration delay, Runnable task) {
    final ManualHandle handle = new ManualHandle(now.plus(delay), null, task, sequence++);
    handles.add(handle);
    return handle;
  }

  @Override
  public synchronized TimerHandle scheduleWithFixedDelay(
      Duration initialDelay, Duration delay, Runnable task) {
    final ManualHandle handle = new ManualHandle(now.plus(initialDelay), delay, task, sequence++);
    handles.add(handle);
    return handle;
  }

  public void advance(Duration duration) {
    final Duration target;
    synchronized (this) {
      target = now.plus(duration);
    }
    while (true) {
      final ManualHandle next;
      synchronized (this) {
        final Optional<ManualHandle> due =
            handles.stream()
                .filter(ManualHandle::isActive)
                .filter(handle -> handle.dueAt.compareTo(target) <= 0)
                .min(
                    Comparator.comparing((ManualHandle handle) -> handle.dueAt)
                        .thenComparingLong(handle -> handle.sequence));
        if (due.isEmpty()) {
          now = target;
          handles.removeIf(handle -> !handle.isActive());
          return;
        }
        next = due.get();
        if (next.dueAt.compareTo(now) > 0) {
          now = next.dueAt;
        }
        if (next.period == null) {
          next.active = false;
        } else {
          next.dueAt = now.plus(next.period);
        }
      }
      next.task.run();
    }
  }

  public void runDue() {
    advance(Duration.ZERO);
  }

  public synchronized int activeCount() {
    return (int) handles.stream().filter(ManualHandle::isActive).count();
  }

  private static final class ManualHandle implements TimerHandle {

    private final Duration period;
    private final Runnable task;
    private final long sequence;
    private Duration dueAt;
    private volatile boolean active = true;

    private ManualHandle(Duration dueAt, Duration period, Runnable task, long sequence) {
      this.dueAt = dueAt;
      this.period = period;
      this.task = task;
      this.sequence = sequence;
    }

    @Override
    public void cancel() {
      active = false;
    }

    @Override
    public boolean isActive() {
      return active;
    }
  }
}
