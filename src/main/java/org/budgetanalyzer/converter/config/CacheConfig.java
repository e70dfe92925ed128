package org.budgetanalyzer.converter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.budgetanalyzer.converter.service.dto.CachedRate;

/**
 * Redis configuration for the rate cache.
 *
 * <p><b>Rate Cache Configuration:</b>
 *
 * <ul>
 *   <li><b>TTL:</b> Applied per write by {@code RedisRateCacheStore} from {@code
 *       currency-converter.cache.ttl-seconds} (300 seconds by default). Redis expires entries on
 *       its own, the service never re-checks freshness.
 *   <li><b>Key Structure:</b> {@code rate:{BASE}:{TARGET}}, e.g. {@code rate:USD:EUR}. The prefix
 *       makes it possible to clear every cached rate without touching other keys.
 *   <li><b>Serialization:</b> JSON for human-readable debugging with {@code redis-cli}
 * </ul>
 */
@Configuration
public class CacheConfig {

  /**
   * Template for reading and writing cached rates.
   *
   * @param connectionFactory auto-configured Redis connection factory
   * @param objectMapper application-wide ObjectMapper with JavaTimeModule registered
   * @return template with string keys and JSON {@link CachedRate} values
   */
  @Bean
  public RedisTemplate<String, CachedRate> rateRedisTemplate(
      RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
    var valueSerializer = new Jackson2JsonRedisSerializer<>(objectMapper, CachedRate.class);

    var template = new RedisTemplate<String, CachedRate>();
    template.setConnectionFactory(connectionFactory);
    template.setKeySerializer(new StringRedisSerializer());
    template.setValueSerializer(valueSerializer);
    template.afterPropertiesSet();

    return template;
  }
}
