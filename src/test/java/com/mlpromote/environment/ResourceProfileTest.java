package com.mlpromote.environment;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResourceProfileTest {

    @Test
    void shouldReadSizeFactorFromInstanceClass() {
        assertEquals(4, profile("ml.m5.4xlarge").sizeFactor());
        assertEquals(12, profile("ml.c5.12xlarge").sizeFactor());
        assertEquals(1, profile("ml.m5.xlarge").sizeFactor());
        assertEquals(1, profile("ml.t2.medium").sizeFactor());
    }

    @Test
    void shouldCapOversizedMultipliers() {
        assertEquals(ResourceProfile.MAX_SIZE_FACTOR, profile("ml.m5.99999999999xlarge").sizeFactor());
        assertEquals(ResourceProfile.MAX_SIZE_FACTOR, profile("ml.m5.5000xlarge").sizeFactor());
        assertEquals(48, profile("ml.m5.48xlarge").sizeFactor());
    }

    @Test
    void shouldDefaultToDisabledMonitoring() {
        assertFalse(profile("ml.m5.xlarge").monitoring().enabled());
    }

    @Test
    void shouldValidateMonitoringPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new MonitoringPolicy(true, 101, 60));
        assertThrows(IllegalArgumentException.class, () -> new MonitoringPolicy(true, 100, 0));
        assertEquals("capture 25%, schedule every 60m", new MonitoringPolicy(true, 25, 60).describe());
        assertEquals("disabled", MonitoringPolicy.disabled().describe());
    }

    @Test
    void shouldDefaultToDisabledAutoscaling() {
        assertFalse(new ResourceProfile("ml.m5.xlarge", 1, 1, 1, null, null).autoscaling().enabled());
    }

    @Test
    void shouldRejectInconsistentReplicaBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceProfile("ml.m5.xlarge", 1, 0, 2, null, null));
        assertThrows(IllegalArgumentException.class, () -> new ResourceProfile("ml.m5.xlarge", 3, 3, 2, null, null));
        assertThrows(IllegalArgumentException.class, () -> new ResourceProfile("ml.m5.xlarge", 5, 1, 4, null, null));
    }

    private static ResourceProfile profile(String instanceClass) {
        return new ResourceProfile(instanceClass, 1, 1, 1, AutoscalingPolicy.disabled(), null);
    }
}
