package com.phillippitts.estatesearch.config.worker;

import com.phillippitts.estatesearch.config.properties.WorkerProperties;
import com.phillippitts.estatesearch.service.worker.DefaultWorkerDirectory;
import com.phillippitts.estatesearch.service.worker.HttpWorkerEndpoint;
import com.phillippitts.estatesearch.service.worker.WorkerDirectory;
import com.phillippitts.estatesearch.service.worker.WorkerEndpoint;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds the worker directory from {@code estate.workers.endpoints}: one HTTP endpoint per
 * configured kind, an always-failing endpoint for the rest.
 */
@Configuration
public class WorkerEndpointConfig {

    @Bean
    public RestClient workerRestClient(RestClient.Builder builder, WorkerProperties workerProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(workerProperties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(workerProperties.getReadTimeoutMs());
        return builder.requestFactory(requestFactory).build();
    }

    @Bean
    public WorkerDirectory workerDirectory(WorkerProperties workerProperties,
                                           RestClient workerRestClient,
                                           @Qualifier("workerExecutor") Executor workerExecutor) {
        List<WorkerEndpoint> endpoints = new ArrayList<>();
        workerProperties.getEndpoints().forEach((kind, uri) ->
                endpoints.add(new HttpWorkerEndpoint(kind, uri, workerRestClient, workerExecutor)));
        return new DefaultWorkerDirectory(endpoints);
    }
}
