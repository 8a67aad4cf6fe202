package com.phillippitts.estatesearch.config.orchestration;

import com.phillippitts.estatesearch.config.properties.MapProperties;
import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.service.channel.InMemoryUserOutbox;
import com.phillippitts.estatesearch.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.estatesearch.service.orchestration.Aggregator;
import com.phillippitts.estatesearch.service.orchestration.Dispatcher;
import com.phillippitts.estatesearch.service.orchestration.EstateSearchCoordinator;
import com.phillippitts.estatesearch.service.orchestration.MapComposer;
import com.phillippitts.estatesearch.service.orchestration.ResponseAssembler;
import com.phillippitts.estatesearch.service.orchestration.RetryScheduler;
import com.phillippitts.estatesearch.service.orchestration.SessionStateMachine;
import com.phillippitts.estatesearch.service.orchestration.TaskSchedulerRetryScheduler;
import com.phillippitts.estatesearch.service.session.SessionStore;
import com.phillippitts.estatesearch.service.worker.WorkerDirectory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the orchestration engine explicitly.
 * Uses constructor injection to manage common dependencies across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    private final OrchestrationProperties orchestrationProperties;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metricsPublisher;

    public OrchestrationConfig(OrchestrationProperties orchestrationProperties,
                               ApplicationEventPublisher publisher,
                               OrchestrationMetricsPublisher metricsPublisher) {
        this.orchestrationProperties = orchestrationProperties;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionStore sessionStore(@Qualifier("coordinatorExecutor") Executor coordinatorExecutor, Clock clock) {
        return new SessionStore(coordinatorExecutor, clock);
    }

    @Bean
    public SessionStateMachine sessionStateMachine() {
        return new SessionStateMachine();
    }

    @Bean
    public Dispatcher dispatcher(WorkerDirectory workerDirectory, SessionStateMachine stateMachine, Clock clock) {
        return new Dispatcher(workerDirectory, stateMachine, orchestrationProperties, publisher, metricsPublisher,
                clock);
    }

    @Bean
    public Aggregator aggregator(Clock clock) {
        return new Aggregator(orchestrationProperties, publisher, metricsPublisher, clock);
    }

    @Bean
    public MapComposer mapComposer(MapProperties mapProperties) {
        return new MapComposer(mapProperties);
    }

    @Bean
    public ResponseAssembler responseAssembler(MapComposer mapComposer, Clock clock) {
        return new ResponseAssembler(mapComposer, clock);
    }

    @Bean
    public InMemoryUserOutbox userOutbox(Clock clock) {
        return new InMemoryUserOutbox(clock);
    }

    @Bean
    public RetryScheduler retryScheduler(TaskScheduler taskScheduler, Clock clock) {
        return new TaskSchedulerRetryScheduler(taskScheduler, clock);
    }

    /**
     * The coordinator; also receives {@code DispatchFailedEvent}s through its event listener.
     */
    @Bean
    public EstateSearchCoordinator estateSearchCoordinator(SessionStore sessionStore,
                                                           Dispatcher dispatcher,
                                                           Aggregator aggregator,
                                                           ResponseAssembler responseAssembler,
                                                           SessionStateMachine stateMachine,
                                                           InMemoryUserOutbox userOutbox,
                                                           RetryScheduler retryScheduler,
                                                           Clock clock) {
        return EstateSearchCoordinator.builder()
                .sessionStore(sessionStore)
                .dispatcher(dispatcher)
                .aggregator(aggregator)
                .responseAssembler(responseAssembler)
                .stateMachine(stateMachine)
                .userChannel(userOutbox)
                .retryScheduler(retryScheduler)
                .properties(orchestrationProperties)
                .publisher(publisher)
                .metrics(metricsPublisher)
                .clock(clock)
                .build();
    }
}
