package com.khartoum.launchpad.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Carries the submitting thread's MDC into pipeline threads and logs how long
 * each detached run or step body took.
 */
@Slf4j
public class LoggingTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        String submissionThreadName = Thread.currentThread().getName();
        Map<String, String> context = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            Instant startTime = Instant.now();
            log.debug(">>> task start | submitted by {}", submissionThreadName);
            try {
                runnable.run();
            } finally {
                log.info("<<< task finish | duration {} ms",
                    Duration.between(startTime, Instant.now()).toMillis());
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
