package com.gatekeeper.core.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring {@link Configuration} for the time sources shared by the coordinator and the history store.
 * <p>
 * Timeout timers run on a single daemon thread; the executor is shut down with the context,
 * which drops any timers still scheduled.
 */
@Configuration
public class ApprovalConfig {

    private static final Logger log = LoggerFactory.getLogger(ApprovalConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService approvalTimeoutScheduler() {
        log.debug("Creating approval timeout scheduler");
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "approval-timeouts");
            thread.setDaemon(true);
            return thread;
        });
    }
}
