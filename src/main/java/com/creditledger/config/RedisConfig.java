package com.creditledger.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.impl.LaissezFaireSubTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis cache configuration for ledger reads.
 *
 * CACHE REGIONS:
 * ==============
 * - profiles: BorrowerProfile by identity (TTL: 30 min)
 * - applications: LoanApplication by id (TTL: 30 min)
 * - loans: ActiveLoan by id (TTL: 10 min, balance changes on every payment)
 *
 * Every write to one of these records evicts its key, so TTL only bounds
 * how long an idle entry occupies memory.
 *
 * The cache manager is transaction aware: evictions happen after commit,
 * so a reader never re-caches a value that is about to be rolled back.
 */
@Configuration
@EnableCaching
@ConditionalOnProperty(name = "lending.cache.redis-enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class RedisConfig {

    public static final String PROFILES = "profiles";
    public static final String APPLICATIONS = "applications";
    public static final String LOANS = "loans";

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        GenericJackson2JsonRedisSerializer jsonSerializer =
            new GenericJackson2JsonRedisSerializer(cacheObjectMapper());

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(30))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new StringRedisSerializer()))
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(jsonSerializer));

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();
        cacheConfigurations.put(PROFILES, defaultConfig
            .entryTtl(Duration.ofMinutes(30))
            .prefixCacheNameWith("ledger:"));
        cacheConfigurations.put(APPLICATIONS, defaultConfig
            .entryTtl(Duration.ofMinutes(30))
            .prefixCacheNameWith("ledger:"));
        cacheConfigurations.put(LOANS, defaultConfig
            .entryTtl(Duration.ofMinutes(10))
            .prefixCacheNameWith("ledger:"));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaultConfig)
            .withInitialCacheConfigurations(cacheConfigurations)
            .transactionAware()
            .build();

        log.info("Configured RedisCacheManager with regions: profiles (30m), applications (30m), loans (10m)");
        return cacheManager;
    }

    /**
     * Mapper for cached values only; the web layer keeps Spring Boot's own.
     * Type info is embedded so cached entities come back as entities, not maps.
     */
    private ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.activateDefaultTyping(LaissezFaireSubTypeValidator.instance,
            ObjectMapper.DefaultTyping.NON_FINAL, JsonTypeInfo.As.PROPERTY);
        return mapper;
    }
}
