package com.carrental.rental.service;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.util.DateRange;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache of availability search results.
 *
 * <p>Keys embed a generation number. Any mutation that can change availability bumps
 * the generation after its transaction commits, which orphans every earlier entry; the
 * orphans expire through their TTL. Redis is never authoritative: every failure is
 * logged and treated as a miss.
 */
@Service
@Slf4j
public class AvailabilityCacheService {

    private static final String SEARCH_KEY_PATTERN = RentalConstants.REDIS_AVAILABILITY_PREFIX + "search:%d:%s:%s:%s";

    private final RedisTemplate<String, Object> redisTemplate;
    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final int ttlMinutes;

    public AvailabilityCacheService(
            RedisTemplate<String, Object> redisTemplate,
            StringRedisTemplate stringRedisTemplate,
            ObjectMapper objectMapper,
            @Value("${rental.availability-cache.enabled:true}") boolean enabled,
            @Value("${rental.availability-cache.ttl-minutes:" + RentalConstants.DEFAULT_CACHE_TTL_MINUTES + "}") int ttlMinutes) {
        this.redisTemplate = redisTemplate;
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.ttlMinutes = ttlMinutes;
    }

    public OptionalLong currentGeneration() {
        if (!enabled) {
            return OptionalLong.empty();
        }
        try {
            String value = stringRedisTemplate.opsForValue().get(RentalConstants.REDIS_GENERATION_KEY);
            return OptionalLong.of(value != null ? Long.parseLong(value) : 0L);
        } catch (Exception e) {
            log.warn("Failed to read availability generation: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }

    public Optional<List<Long>> getSearchResult(long generation, DateRange range, VehicleFilterCriteria criteria) {
        String key = formatSearchKey(generation, range, criteria);
        try {
            Object cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Availability cache hit: key={}", key);
                return Optional.of(objectMapper.convertValue(cached, new TypeReference<List<Long>>() {}));
            }
        } catch (Exception e) {
            log.warn("Failed to read availability cache for {}: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    public void putSearchResult(long generation, DateRange range, VehicleFilterCriteria criteria, List<Long> vehicleIds) {
        String key = formatSearchKey(generation, range, criteria);
        try {
            redisTemplate.opsForValue().set(key, new ArrayList<>(vehicleIds), ttlMinutes, TimeUnit.MINUTES);
            log.debug("Cached availability: key={}, vehicles={}", key, vehicleIds.size());
        } catch (Exception e) {
            log.warn("Failed to cache availability for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Invalidates all cached searches once the current transaction commits, or right away
     * when no transaction is active.
     */
    public void invalidate() {
        if (!enabled) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    bumpGeneration();
                }
            });
        } else {
            bumpGeneration();
        }
    }

    public String formatSearchKey(long generation, DateRange range, VehicleFilterCriteria criteria) {
        return String.format(SEARCH_KEY_PATTERN, generation, range.start(), range.end(), criteria.cacheKey());
    }

    private void bumpGeneration() {
        try {
            Long generation = stringRedisTemplate.opsForValue().increment(RentalConstants.REDIS_GENERATION_KEY);
            log.debug("Availability generation bumped to {}", generation);
        } catch (Exception e) {
            log.error("Failed to bump availability generation: {}", e.getMessage());
        }
    }
}
