package com.machina.provisioning.config;

import com.machina.provisioning.metrics.DeploymentMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for deployment jobs.
 *
 * A bounded queue with AbortPolicy: when both are full, submit fails fast and the
 * deployment is recorded as failed instead of running on the HTTP thread.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Bean(name = "deploymentTaskExecutor")
    public ThreadPoolTaskExecutor deploymentTaskExecutor(
            DeploymentMetrics metrics,
            @Value("${provisioning.async.core-pool-size:4}") int corePoolSize,
            @Value("${provisioning.async.max-pool-size:8}") int maxPoolSize,
            @Value("${provisioning.async.queue-capacity:50}") int queueCapacity,
            @Value("${provisioning.async.await-termination-seconds:60}") int awaitTerminationSeconds) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("deploy-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();

        metrics.registerThreadPoolMetrics("deployment", executor.getThreadPoolExecutor());
        log.info("Initialized deployment executor: core={}, max={}, queue={}, rejection=AbortPolicy",
            corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
            log.error("Uncaught async exception in method '{}': {}", method.getName(), ex.getMessage(), ex);
    }
}
