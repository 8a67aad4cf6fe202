package com.phillippitts.estatesearch;

import com.phillippitts.estatesearch.config.properties.MapProperties;
import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.config.properties.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestrationProperties.class,
        MapProperties.class,
        WorkerProperties.class
})
@EnableScheduling
public class EstateSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstateSearchApplication.class, args);
    }

}
