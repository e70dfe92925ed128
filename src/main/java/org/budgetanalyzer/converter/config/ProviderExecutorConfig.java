package org.budgetanalyzer.converter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the concurrent rate provider fan-out.
 *
 * <p>Kept separate from Spring Boot's {@code applicationTaskExecutor} so that a burst of cold
 * pairs cannot starve other async work, and so provider threads are easy to spot in thread dumps
 * ({@code rate-provider-} prefix).
 */
@Configuration
public class ProviderExecutorConfig {

  public static final String PROVIDER_EXECUTOR = "rateProviderExecutor";

  @Bean(name = PROVIDER_EXECUTOR)
  public ThreadPoolTaskExecutor rateProviderExecutor(CurrencyConverterProperties properties) {
    var poolSize = properties.getProviders().getExecutorPoolSize();

    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(poolSize * 50);
    executor.setThreadNamePrefix("rate-provider-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();

    return executor;
  }
}
