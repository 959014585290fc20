package com.oatcode.backend.config;

import com.oatcode.backend.revision.config.RevisionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncSchedulingConfig {

    /**
     * renderer 呼叫專用：worker 在這裡送出 render，用 Future.get(timeout) 限時
     * pool 大小跟 worker 一次領取的 batch 一致
     */
    @Bean("rendererExecutor")
    public AsyncTaskExecutor rendererExecutor(RevisionProperties props) {
        int size = Math.max(1, props.getWorker().getBatchSize());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(size);
        ex.setMaxPoolSize(size);
        ex.setQueueCapacity(100);
        ex.setThreadNamePrefix("renderer-");
        ex.initialize();
        return ex;
    }
}
