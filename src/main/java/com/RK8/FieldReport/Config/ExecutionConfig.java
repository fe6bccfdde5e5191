package com.RK8.FieldReport.Config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService reportExecutor(ReportProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecution().getPoolSize()), runnable -> {
            Thread thread = new Thread(runnable, "report-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
