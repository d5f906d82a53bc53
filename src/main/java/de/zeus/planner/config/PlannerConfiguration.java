package de.zeus.planner.config;

import org.springframework.boot.task.TaskExecutorBuilder;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Infrastructure beans shared by the planning services.
 */
@Configuration
public class PlannerConfiguration {

    static final int SOLVER_MAX_THREADS = 4;

    @Bean
    public Clock plannerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(20))
                .build();
    }

    /**
     * Runs the optimizer call so the orchestrator can enforce the solver timeout.
     * <p>
     * Without a queue every run gets its own thread, so a solver that ignores cancellation
     * only holds on to its own thread instead of blocking the runs behind it.
     */
    @Bean
    public ThreadPoolTaskExecutor solverTaskExecutor(TaskExecutorBuilder builder) {
        return builder
                .corePoolSize(1)
                .maxPoolSize(SOLVER_MAX_THREADS)
                .queueCapacity(0)
                .keepAlive(Duration.ofMinutes(1))
                .threadNamePrefix("planner-solver-")
                .build();
    }
}
