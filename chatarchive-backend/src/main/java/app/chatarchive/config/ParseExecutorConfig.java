package app.chatarchive.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for conversation-level parsing. Conversations are independent and CPU bound, so
 * the pool is sized to the configured parallelism. When the queue is full the caller parses the
 * conversation itself.
 */
@Configuration
public class ParseExecutorConfig {

    public static final String PARSE_EXECUTOR = "conversationParseExecutor";

    @Bean(name = PARSE_EXECUTOR)
    public Executor conversationParseExecutor(ArchiveProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.parseParallelism());
        executor.setMaxPoolSize(properties.parseParallelism());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("archive-parse-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
