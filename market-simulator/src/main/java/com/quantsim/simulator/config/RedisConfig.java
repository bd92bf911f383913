package com.quantsim.simulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.infrastructure.cache.RedisPriceCacheStore;
import com.quantsim.simulator.marketdata.PriceCacheStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed price cache, active with {@code simulator.cache.store=redis}.
 */
@Configuration
@ConditionalOnProperty(name = "simulator.cache.store", havingValue = "redis")
public class RedisConfig {

        @Bean
        public StringRedisTemplate priceCacheRedisTemplate(RedisConnectionFactory connectionFactory) {
                return new StringRedisTemplate(connectionFactory);
        }

        @Bean
        public PriceCacheStore redisPriceCacheStore(StringRedisTemplate priceCacheRedisTemplate,
                                                    ObjectMapper objectMapper,
                                                    @Value("${simulator.cache.redis-ttl:PT0S}") Duration ttl) {
                return new RedisPriceCacheStore(priceCacheRedisTemplate, objectMapper, ttl);
        }
}
