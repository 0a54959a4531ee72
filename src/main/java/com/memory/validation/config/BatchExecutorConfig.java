package com.memory.validation.config;

import com.memory.validation.concurrent.MdcAwareExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

@Configuration
public class BatchExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchExecutor(BatchConfig batchConfig) {
        return MdcAwareExecutor.fixed("batch-worker", batchConfig.getMaxWorkers());
    }
}
