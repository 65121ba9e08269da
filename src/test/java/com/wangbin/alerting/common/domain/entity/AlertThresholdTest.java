package com.wangbin.alerting.common.domain.entity;

import com.wangbin.alerting.common.domain.enums.ThresholdLevel;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AlertThresholdTest {

    private AlertThreshold responseTime() {
        return AlertThreshold.builder()
                .metric("response_time")
                .warningMax(2000d)
                .criticalMax(5000d)
                .autoResolveTimeout(15)
                .build();
    }

    @Test
    void criticalBoundWinsOverWarning() {
        Optional<ThresholdBreach> breach = responseTime().evaluate(6000);
        assertTrue(breach.isPresent());
        assertEquals(ThresholdLevel.CRITICAL, breach.get().level());
        assertEquals(5000d, breach.get().limit());

        assertEquals(ThresholdLevel.WARNING, responseTime().evaluate(2500).get().level());
        assertTrue(responseTime().evaluate(2000).isEmpty());
    }

    @Test
    void lowerBoundsBreachBelowLimit() {
        AlertThreshold revenue = AlertThreshold.builder()
                .metric("revenue").warningMin(1000d).criticalMin(500d).build();

        assertTrue(revenue.evaluate(400).get().isCritical());
        assertFalse(revenue.evaluate(800).get().isCritical());
        assertTrue(revenue.evaluate(1000).isEmpty());
    }

    @Test
    void disabledThresholdNeverBreaches() {
        AlertThreshold disabled = responseTime().toBuilder().enabled(false).build();
        assertTrue(disabled.evaluate(100_000).isEmpty());
    }

    @Test
    void criticalMustBeMoreExtremeThanWarning() {
        assertTrue(responseTime().isValid());

        AlertThreshold inverted = responseTime().toBuilder().criticalMax(1500d).build();
        assertFalse(inverted.isValid());

        AlertThreshold invertedMin = AlertThreshold.builder()
                .metric("revenue").warningMin(500d).criticalMin(1000d).build();
        assertEquals(1, invertedMin.validate().size());
    }

    @Test
    void mergeKeepsUnsetFieldsAndLeavesOriginalUntouched() {
        AlertThreshold original = responseTime();
        AlertThreshold merged = original.merge(ThresholdPatch.builder().warningMax(3000d).build());

        assertEquals(3000d, merged.getWarningMax());
        assertEquals(5000d, merged.getCriticalMax());
        assertEquals(15, merged.getAutoResolveTimeout());
        assertEquals(2000d, original.getWarningMax());
    }
}
