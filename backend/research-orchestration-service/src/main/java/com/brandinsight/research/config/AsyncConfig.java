package com.brandinsight.research.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    @Value("${async.checkpoint.core-pool-size:6}")
    private int checkpointCorePoolSize;

    @Value("${async.checkpoint.max-pool-size:12}")
    private int checkpointMaxPoolSize;

    @Value("${async.checkpoint.queue-capacity:100}")
    private int checkpointQueueCapacity;

    /**
     * 체크포인트 카운트 병렬 조회 전용 실행자.
     * 거부 시 호출 스레드에서 실행하여 카운트가 누락되지 않도록 합니다.
     */
    @Bean(name = "checkpointExecutor")
    public Executor checkpointExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(checkpointCorePoolSize);
        executor.setMaxPoolSize(checkpointMaxPoolSize);
        executor.setQueueCapacity(checkpointQueueCapacity);
        executor.setThreadNamePrefix("checkpoint-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
