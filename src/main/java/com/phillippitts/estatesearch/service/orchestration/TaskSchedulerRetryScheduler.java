package com.phillippitts.estatesearch.service.orchestration;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link RetryScheduler} on top of Spring's {@link TaskScheduler}.
 */
public class TaskSchedulerRetryScheduler implements RetryScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerRetryScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        taskScheduler.schedule(task, clock.instant().plus(delay));
    }
}
