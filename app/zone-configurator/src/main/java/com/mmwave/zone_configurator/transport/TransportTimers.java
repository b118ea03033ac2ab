package com.mmwave.zone_configurator.transport;

import java.time.Duration;

public interface TransportTimers {

  TimerHandle schedule(Duration delay, Runnable task);

  TimerHandle scheduleWithFixedDelay(Duration initialDelay, Duration delay, Runnable task);

  interface TimerHandle {

    void cancel();

    boolean isActive();
  }
}
