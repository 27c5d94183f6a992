package dev.mars.arbiter.service;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.arbiter.config.ArbiterConfig;
import dev.mars.arbiter.core.exceptions.ServiceInitializationException;
import dev.mars.arbiter.service.lifecycle.ShutdownSequence;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(VertxExtension.class)
@DisplayName("ServiceOrchestrator Tests")
class ServiceOrchestratorTest {

    private final AtomicInteger factoryCalls = new AtomicInteger();
    private ArbiterService service;

    @BeforeEach
    void setUp() {
        service = mock(ArbiterService.class);
        when(service.isInitialized()).thenReturn(true);
        when(service.getStatus()).thenReturn(Future.succeededFuture(
                new ServiceStatus(0, 0, null, null, Duration.ZERO)));
        when(service.shutdown(any(ShutdownSequence.class)))
                .thenAnswer(inv -> inv.<ShutdownSequence>getArgument(0).run());
    }

    private static ArbiterConfig config(boolean healthEnabled) {
        Properties properties = new Properties();
        properties.setProperty(ArbiterConfig.HEALTH_ENABLED, String.valueOf(healthEnabled));
        properties.setProperty(ArbiterConfig.HEALTH_INTERVAL_MS, "50");
        properties.setProperty(ArbiterConfig.SHUTDOWN_HOOK_TIMEOUT_MS, "1000");
        return ArbiterConfig.fromProperties(properties);
    }

    private ServiceFactory delayedFactory(long delayMs) {
        return (vertx, config) -> {
            factoryCalls.incrementAndGet();
            return vertx.timer(delayMs).map(t -> service);
        };
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("Concurrent callers should share a single initialization")
        void concurrentCallsInitializeOnce(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(100));
            int callers = 16;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            Set<Future<ArbiterService>> futures = ConcurrentHashMap.newKeySet();
            try {
                List<java.util.concurrent.Future<?>> submitted = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    submitted.add(pool.submit(() -> {
                        start.await();
                        futures.add(orchestrator.getService());
                        return null;
                    }));
                }
                start.countDown();
                for (java.util.concurrent.Future<?> f : submitted) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } catch (Exception e) {
                ctx.failNow(e);
                return;
            } finally {
                pool.shutdownNow();
            }
            List<Future<ArbiterService>> all = new ArrayList<>(futures);

            assertEquals(1, all.size());
            Future.all(all).onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertEquals(1, factoryCalls.get());
                assertSame(service, all.get(0).result());
                assertTrue(orchestrator.getStatus().initialized());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Initialization in flight should be reported as initializing")
        void initializingStatus(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(200));

            Future<ArbiterService> pending = orchestrator.getService();
            OrchestratorStatus status = orchestrator.getStatus();
            assertTrue(status.initializing());
            assertFalse(status.initialized());
            assertFalse(status.serviceAvailable());

            pending.onComplete(ctx.succeeding(s -> ctx.verify(() -> {
                OrchestratorStatus ready = orchestrator.getStatus();
                assertTrue(ready.initialized());
                assertFalse(ready.initializing());
                assertTrue(ready.serviceAvailable());
                assertEquals("development", ready.environment());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Failed initialization should clear the slot so the next call retries")
        void failureAllowsRetry(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), (v, c) -> {
                if (factoryCalls.incrementAndGet() == 1) {
                    return Future.failedFuture(new IllegalStateException("storage offline"));
                }
                return Future.succeededFuture(service);
            });

            orchestrator.getService().onComplete(ctx.failing(err -> {
                ctx.verify(() -> {
                    assertInstanceOf(ServiceInitializationException.class, err);
                    assertTrue(err.getMessage().contains("storage offline"));
                    assertFalse(orchestrator.getStatus().initialized());
                });
                orchestrator.getService().onComplete(ctx.succeeding(s -> ctx.verify(() -> {
                    assertSame(service, s);
                    assertEquals(2, factoryCalls.get());
                    ctx.completeNow();
                })));
            }));
        }

        @Test
        @DisplayName("Every waiter of a failed attempt should see the failure")
        void waitersSeeFailure(Vertx vertx, VertxTestContext ctx) {
            Promise<ArbiterService> attempt = Promise.promise();
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), (v, c) -> {
                factoryCalls.incrementAndGet();
                return attempt.future();
            });
            Future<ArbiterService> first = orchestrator.getService();
            Future<ArbiterService> second = orchestrator.getService();
            attempt.fail(new IllegalStateException("boom"));

            Future.join(first, second).onComplete(ar -> ctx.verify(() -> {
                assertTrue(first.failed());
                assertTrue(second.failed());
                assertEquals(1, factoryCalls.get());
                ctx.completeNow();
            }));
        }

        @Test
        @DisplayName("Factory throwing outright should fail the attempt")
        void factoryThrows(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), (v, c) -> {
                throw new IllegalArgumentException("bad wiring");
            });

            orchestrator.getService().onComplete(ctx.failing(err -> ctx.verify(() -> {
                assertInstanceOf(ServiceInitializationException.class, err);
                assertInstanceOf(IllegalArgumentException.class, err.getCause());
                ctx.completeNow();
            })));
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class ShutdownTests {

        @Test
        @DisplayName("Shutdown before initialization should succeed")
        void shutdownWhenNeverInitialized(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(10));

            orchestrator.shutdown()
                    .compose(v -> orchestrator.shutdown())
                    .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                        assertEquals(0, factoryCalls.get());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Concurrent shutdowns should share one service shutdown")
        void concurrentShutdown(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(10));

            orchestrator.getService()
                    .compose(s -> {
                        Future<Void> first = orchestrator.shutdown();
                        Future<Void> second = orchestrator.shutdown();
                        ctx.verify(() -> assertSame(first, second));
                        return Future.all(first, second);
                    })
                    .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                        verify(service, times(1)).shutdown(any(ShutdownSequence.class));
                        assertFalse(orchestrator.getStatus().initialized());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Service should be initialized again after shutdown")
        void reinitializeAfterShutdown(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(10));

            orchestrator.getService()
                    .compose(s -> orchestrator.shutdown())
                    .compose(v -> orchestrator.getService())
                    .onComplete(ctx.succeeding(s -> ctx.verify(() -> {
                        assertEquals(2, factoryCalls.get());
                        assertTrue(orchestrator.getStatus().initialized());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Shutdown should stop health monitoring")
        void shutdownStopsMonitoring(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(true), delayedFactory(10));

            Future<ArbiterService> ready = orchestrator.getService();
            await().atMost(Duration.ofSeconds(2)).until(ready::succeeded);
            assertTrue(orchestrator.getStatus().healthMonitoring());
            await().atMost(Duration.ofSeconds(2))
                    .untilAsserted(() -> verify(service, atLeast(2)).getStatus());

            orchestrator.shutdown().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
                assertFalse(orchestrator.getStatus().healthMonitoring());
                ctx.completeNow();
            })));
        }
    }

    @Nested
    @DisplayName("Health validation")
    class HealthTests {

        @Test
        @DisplayName("Validation should report false before initialization")
        void notInitialized(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(10));

            orchestrator.validateHealth().onComplete(ctx.succeeding(healthy -> ctx.verify(() -> {
                assertFalse(healthy);
                assertEquals(0, factoryCalls.get());
                ctx.completeNow();
            })));
        }

        @Test
        @DisplayName("Validation should follow the service status check")
        void followsStatusCheck(Vertx vertx, VertxTestContext ctx) {
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(vertx, config(false), delayedFactory(10));

            orchestrator.getService()
                    .compose(s -> orchestrator.validateHealth())
                    .compose(healthy -> {
                        ctx.verify(() -> assertTrue(healthy));
                        when(service.getStatus()).thenReturn(Future.failedFuture(new IllegalStateException("down")));
                        return orchestrator.validateHealth();
                    })
                    .onComplete(ctx.succeeding(healthy -> ctx.verify(() -> {
                        assertFalse(healthy);
                        ctx.completeNow();
                    })));
        }
    }
}
