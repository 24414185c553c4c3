package com.seatwatch.monitor.service.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RouteLeaseService Unit Tests")
class RouteLeaseServiceTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RouteLeaseService leaseService;

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(stringRedisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);
        leaseService = new RouteLeaseService(stringRedisTemplate, 60_000);
    }

    @Test
    @DisplayName("Should run the action and release the lease when it is free")
    void executeIfLeased_Free_RunsAndReleases() {
        when(valueOperations.setIfAbsent(eq("lease:route:42"), anyString(), eq(60_000L), eq(TimeUnit.MILLISECONDS)))
                .thenReturn(true);

        Optional<String> result = leaseService.executeIfLeased("42", () -> "checked");

        assertThat(result).contains("checked");
        verify(stringRedisTemplate).execute(any(RedisScript.class), eq(List.of("lease:route:42")), anyString());
    }

    @Test
    @DisplayName("Should skip the action without waiting when the lease is held")
    void executeIfLeased_Held_Skips() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean();

        Optional<Boolean> result = leaseService.executeIfLeased("42", () -> {
            ran.set(true);
            return true;
        });

        assertThat(result).isEmpty();
        assertThat(ran).isFalse();
        verify(valueOperations, times(1)).setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class));
        verify(stringRedisTemplate, never()).execute(any(RedisScript.class), anyList(), any());
    }

    @Test
    @DisplayName("Should release the lease when the action fails")
    void executeIfLeased_ActionThrows_Releases() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(true);

        assertThatThrownBy(() -> leaseService.executeIfLeased("42", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(stringRedisTemplate).execute(any(RedisScript.class), eq(List.of("lease:route:42")), anyString());
    }

    @Test
    @DisplayName("Should use a distinct owner token for each acquisition")
    void tryAcquire_TokensDiffer() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(true);

        RouteLeaseService.LeaseHandle first = leaseService.tryAcquire("42");
        RouteLeaseService.LeaseHandle second = leaseService.tryAcquire("42");

        assertThat(first.getLeaseValue()).isNotEqualTo(second.getLeaseValue());
        assertThat(first.getLeaseKey()).isEqualTo("lease:route:42");
    }
}
