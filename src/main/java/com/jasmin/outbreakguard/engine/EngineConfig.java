package com.jasmin.outbreakguard.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(EngineProperties props) {
        return Executors.newFixedThreadPool(props.getParallelism(), new CustomizableThreadFactory("detection-"));
    }
}
