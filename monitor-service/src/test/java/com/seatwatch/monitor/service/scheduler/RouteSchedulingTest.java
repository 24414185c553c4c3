package com.seatwatch.monitor.service.scheduler;

import com.seatwatch.monitor.service.RouteRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Scheduler and Sweeper Unit Tests")
class RouteSchedulingTest {

    @Mock
    private RouteRegistry routeRegistry;

    @Mock
    private RouteCheckWorker routeCheckWorker;

    private RouteCheckScheduler scheduler;
    private RouteExpirySweeper sweeper;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new RouteCheckScheduler(routeRegistry, routeCheckWorker);
        sweeper = new RouteExpirySweeper(routeRegistry, meterRegistry);
    }

    @Nested
    @DisplayName("Check Tick Tests")
    class CheckTickTests {

        @Test
        @DisplayName("Should stamp all routes once and then dispatch one check per route")
        void scheduleChecks_StampsThenDispatches() {
            when(routeRegistry.findIdsToCheck()).thenReturn(List.of(1L, 2L, 3L));

            scheduler.scheduleChecks();

            InOrder order = inOrder(routeRegistry, routeCheckWorker);
            order.verify(routeRegistry).stampLastChecked(List.of(1L, 2L, 3L));
            order.verify(routeCheckWorker).checkRoute(1L);
            order.verify(routeCheckWorker).checkRoute(2L);
            order.verify(routeCheckWorker).checkRoute(3L);
        }

        @Test
        @DisplayName("Should do nothing when no route is monitored")
        void scheduleChecks_NoRoutes_NoWrites() {
            when(routeRegistry.findIdsToCheck()).thenReturn(List.of());

            scheduler.scheduleChecks();

            verify(routeRegistry, never()).stampLastChecked(any());
            verifyNoInteractions(routeCheckWorker);
        }

        @Test
        @DisplayName("Should keep dispatching when the pool rejects one route")
        void scheduleChecks_Rejected_ContinuesWithOthers() {
            when(routeRegistry.findIdsToCheck()).thenReturn(List.of(1L, 2L));
            doThrow(new TaskRejectedException("full")).when(routeCheckWorker).checkRoute(1L);

            assertThatCode(() -> scheduler.scheduleChecks()).doesNotThrowAnyException();

            verify(routeCheckWorker).checkRoute(2L);
        }
    }

    @Nested
    @DisplayName("Sweep Tests")
    class SweepTests {

        @Test
        @DisplayName("Should expire every departed route and count the transitions")
        void expireDepartedRoutes_ExpiresCandidates() {
            when(routeRegistry.findIdsToExpire()).thenReturn(List.of(1L, 2L, 3L));
            when(routeRegistry.markExpired(1L)).thenReturn(true);
            when(routeRegistry.markExpired(2L)).thenReturn(false);
            when(routeRegistry.markExpired(3L)).thenReturn(true);

            assertThat(sweeper.expireDepartedRoutes()).isEqualTo(2);
            assertThat(meterRegistry.counter("monitor.sweep.expired").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should continue past a route that fails to expire")
        void expireDepartedRoutes_OneFails_ContinuesWithOthers() {
            when(routeRegistry.findIdsToExpire()).thenReturn(List.of(1L, 2L));
            when(routeRegistry.markExpired(1L)).thenThrow(new IllegalStateException("deadlock"));
            when(routeRegistry.markExpired(2L)).thenReturn(true);

            assertThat(sweeper.expireDepartedRoutes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should do nothing without departed routes")
        void expireDepartedRoutes_NoCandidates() {
            when(routeRegistry.findIdsToExpire()).thenReturn(List.of());

            assertThat(sweeper.expireDepartedRoutes()).isZero();
            verify(routeRegistry, never()).markExpired(any());
        }
    }
}
