package app.corvana.importer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ImportExecutorConfig {

    @Bean(name = "importTaskExecutor")
    public ThreadPoolTaskExecutor importTaskExecutor(ImportProps props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.commitThreads());
        executor.setMaxPoolSize(props.commitThreads());
        executor.setQueueCapacity(props.commitQueueCapacity());
        executor.setThreadNamePrefix("import-commit-");
        // a full queue rejects the commit instead of running it on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
