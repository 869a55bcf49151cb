package com.carrental.rental.service;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.util.DateRange;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AvailabilityCacheService Unit Tests")
class AvailabilityCacheServiceTest {

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> objectOperations;

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AvailabilityCacheService cacheService;

    private final DateRange range = DateRange.of(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 4));
    private final VehicleFilterCriteria criteria = VehicleFilterCriteria.none();

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(objectOperations);
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        cacheService = new AvailabilityCacheService(redisTemplate, stringRedisTemplate, objectMapper, true, 10);
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Missing generation key reads as zero")
    void currentGeneration_Missing_Zero() {
        when(valueOperations.get(RentalConstants.REDIS_GENERATION_KEY)).thenReturn(null);

        assertThat(cacheService.currentGeneration()).hasValue(0L);
    }

    @Test
    @DisplayName("Redis failure disables caching for the call")
    void currentGeneration_RedisDown_Empty() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cacheService.currentGeneration()).isEmpty();
    }

    @Test
    @DisplayName("Disabled cache never touches Redis")
    void disabled_NoRedisCalls() {
        AvailabilityCacheService disabled = new AvailabilityCacheService(
                redisTemplate, stringRedisTemplate, objectMapper, false, 10);

        assertThat(disabled.currentGeneration()).isEmpty();
        disabled.invalidate();

        verifyNoInteractions(redisTemplate, stringRedisTemplate);
    }

    @Test
    @DisplayName("Stored ids are read back in order")
    void putThenGet_SameIds() {
        String key = cacheService.formatSearchKey(4L, range, criteria);

        cacheService.putSearchResult(4L, range, criteria, List.of(3L, 11L, 12L));
        verify(objectOperations).set(key, List.of(3L, 11L, 12L), 10, TimeUnit.MINUTES);

        // JSON numbers come back as Integers when they fit
        when(objectOperations.get(key)).thenReturn(List.of(3, 11, 12));
        assertThat(cacheService.getSearchResult(4L, range, criteria)).hasValue(List.of(3L, 11L, 12L));
    }

    @Test
    @DisplayName("An empty cached result is a hit with no vehicles")
    void getSearchResult_EmptyValue_EmptyList() {
        when(objectOperations.get(cacheService.formatSearchKey(4L, range, criteria))).thenReturn(List.of());

        assertThat(cacheService.getSearchResult(4L, range, criteria)).hasValue(List.of());
    }

    @Test
    @DisplayName("Unreadable cached value is treated as a miss")
    void getSearchResult_UnexpectedShape_Miss() {
        when(objectOperations.get(cacheService.formatSearchKey(4L, range, criteria))).thenReturn("not-a-list");

        assertThat(cacheService.getSearchResult(4L, range, criteria)).isEmpty();
    }

    @Test
    @DisplayName("Redis failure on lookup is a miss")
    void getSearchResult_RedisDown_Miss() {
        when(objectOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cacheService.getSearchResult(4L, range, criteria)).isEmpty();
    }

    @Test
    @DisplayName("Keys differ across generations")
    void formatSearchKey_IncludesGeneration() {
        assertThat(cacheService.formatSearchKey(1L, range, criteria))
                .isNotEqualTo(cacheService.formatSearchKey(2L, range, criteria))
                .startsWith(RentalConstants.REDIS_AVAILABILITY_PREFIX);
    }

    @Test
    @DisplayName("Invalidation waits for the transaction to commit")
    void invalidate_InTransaction_BumpsAfterCommit() {
        TransactionSynchronizationManager.initSynchronization();

        cacheService.invalidate();
        verify(valueOperations, never()).increment(anyString());

        TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
        verify(valueOperations).increment(RentalConstants.REDIS_GENERATION_KEY);
    }

    @Test
    @DisplayName("Invalidation outside a transaction bumps immediately")
    void invalidate_NoTransaction_BumpsNow() {
        cacheService.invalidate();

        verify(valueOperations).increment(RentalConstants.REDIS_GENERATION_KEY);
    }

    @Test
    @DisplayName("Redis failure while bumping is not propagated")
    void invalidate_RedisDown_Swallowed() {
        when(valueOperations.increment(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThatCode(() -> cacheService.invalidate()).doesNotThrowAnyException();
    }
}
