package com.deskhub.inbox.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for per-value aggregation counts. A full queue runs the count on the caller thread
 * so a high-cardinality dimension slows the request down instead of flooding the database.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class AggregationExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(AggregationExecutorConfig.class);

    @Bean(name = "aggregationExecutor", destroyMethod = "shutdown")
    public ExecutorService aggregationExecutor(AggregationProperties props) {
        log.info("aggregation_executor_init poolSize={} queueCapacity={} timeoutMs={}",
                props.poolSize(), props.queueCapacity(), props.timeoutMs());

        var seq = new AtomicInteger();
        var executor = new ThreadPoolExecutor(
                props.poolSize(),
                props.poolSize(),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(props.queueCapacity()),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("aggregation-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
