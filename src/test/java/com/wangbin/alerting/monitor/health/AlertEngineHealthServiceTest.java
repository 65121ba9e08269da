package com.wangbin.alerting.monitor.health;

import com.wangbin.alerting.core.scheduler.AlertScheduler;
import com.wangbin.alerting.monitor.health.EngineHealth.Status;
import com.wangbin.alerting.support.MutableClock;
import com.wangbin.alerting.support.StaticCollector;
import com.wangbin.alerting.support.TestEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AlertEngineHealthServiceTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");

    private AlertEngineHealthService healthService(TestEngine engine, AlertScheduler scheduler) {
        return new AlertEngineHealthService(scheduler, engine.pipeline, engine.channels,
                engine.persister, engine.properties, clock);
    }

    private AlertScheduler scheduler(TestEngine engine) {
        return new AlertScheduler(mock(ScheduledExecutorService.class), engine.pipeline, engine.lifecycle,
                engine.store, engine.persister, engine.properties);
    }

    @Test
    void runningEngineWithHealthyCollectorsIsUp() {
        TestEngine engine = TestEngine.create(clock, List.of(new StaticCollector("static", List::of)));
        AlertScheduler scheduler = scheduler(engine);
        scheduler.start();
        scheduler.runOnce();

        EngineHealth health = healthService(engine, scheduler).getHealth();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(clock.instant(), health.getCheckedAt());
        assertEquals(List.of("scheduler", "collector.static", "channels", "persistence"),
                List.copyOf(health.getComponents().keySet()));
        assertEquals(1L, health.getComponents().get("scheduler").getDetails().get("tickCount"));
        assertEquals(true, health.getComponents().get("channels").getDetails().get("slack"));
    }

    @Test
    void failingCollectorDegradesRunningEngine() {
        TestEngine engine = TestEngine.create(clock, List.of(new StaticCollector("broken", () -> {
            throw new IllegalStateException("down");
        })));
        AlertScheduler scheduler = scheduler(engine);
        scheduler.start();
        scheduler.runOnce();

        EngineHealth health = healthService(engine, scheduler).getHealth();

        assertEquals(Status.DEGRADED, health.getStatus());
        assertEquals(Status.DEGRADED, health.getComponents().get("collector.broken").getStatus());
    }

    @Test
    void stoppedSchedulerOutranksDegradedComponents() {
        TestEngine engine = TestEngine.create(clock, List.of(new StaticCollector("broken", () -> {
            throw new IllegalStateException("down");
        })));
        AlertScheduler scheduler = scheduler(engine);
        scheduler.runOnce();

        assertEquals(Status.STOPPED, healthService(engine, scheduler).getHealth().getStatus());
    }
}
