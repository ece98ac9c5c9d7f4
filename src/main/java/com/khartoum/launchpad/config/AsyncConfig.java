package com.khartoum.launchpad.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String PROVISIONING_EXECUTOR = "provisioningExecutor";
    public static final String STEP_EXECUTOR = "pipelineStepExecutor";

    /**
     * Runs one detached launch pipeline per request. Rejections are logged
     * and surface to the caller as a failed hand-off.
     */
    @Bean(name = PROVISIONING_EXECUTOR)
    public ThreadPoolTaskExecutor provisioningExecutor(LaunchpadProperties properties) {
        LaunchpadProperties.Pipeline pipeline = properties.getPipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.getCorePoolSize());
        executor.setMaxPoolSize(pipeline.getMaxPoolSize());
        executor.setQueueCapacity(pipeline.getQueueCapacity());
        executor.setThreadNamePrefix("launch-");
        executor.setTaskDecorator(new LoggingTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("Provisioning executor wired with CorePoolSize: {}, MaxPoolSize: {}, QueueCapacity: {}",
            executor.getCorePoolSize(), executor.getMaxPoolSize(), pipeline.getQueueCapacity());
        return executor;
    }

    /**
     * Runs individual step bodies so the pipeline can bound and cancel them.
     * Decorated as well so step logs keep the launch's job id.
     */
    @Bean(name = STEP_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineStepExecutor(LaunchpadProperties properties) {
        LaunchpadProperties.Pipeline pipeline = properties.getPipeline();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.getCorePoolSize());
        executor.setMaxPoolSize(pipeline.getMaxPoolSize());
        executor.setQueueCapacity(pipeline.getQueueCapacity());
        executor.setThreadNamePrefix("launch-step-");
        executor.setTaskDecorator(new LoggingTaskDecorator());
        executor.initialize();
        return executor;
    }
}
