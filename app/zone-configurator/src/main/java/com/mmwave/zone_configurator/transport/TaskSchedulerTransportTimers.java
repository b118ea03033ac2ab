package com.mmwave.zone_configurator.transport;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

public class TaskSchedulerTransportTimers implements TransportTimers {

  private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerTransportTimers.class);

  private final ThreadPoolTaskScheduler scheduler;
  private final Clock clock;

  public TaskSchedulerTransportTimers(int poolSize, Clock clock) {
    this.clock = clock;
    this.scheduler = new ThreadPoolTaskScheduler();
    this.scheduler.setPoolSize(poolSize);
    this.scheduler.setThreadNamePrefix("ha-transport-timer-");
    this.scheduler.setRemoveOnCancelPolicy(true);
    this.scheduler.setWaitForTasksToCompleteOnShutdown(false);
    this.scheduler.initialize();
  }

  @Override
  public TimerHandle schedule(Duration delay, Runnable task) {
    return new FutureHandle(
        scheduler.schedule(guarded(task), clock.instant().plus(delay)));
  }

  @Override
  public TimerHandle scheduleWithFixedDelay(
      Duration initialDelay, Duration delay, Runnable task) {
    return new FutureHandle(
        scheduler.scheduleWithFixedDelay(
            guarded(task), clock.instant().plus(initialDelay), delay));
  }

  public void shutdown() {
    scheduler.shutdown();
  }

  // 例外で周期タスクが止まらないようにする
  private Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        logger.error("transport timer task failed", ex);
      }
    };
  }

  private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isActive() {
      return !future.isDone();
    }
  }
}
