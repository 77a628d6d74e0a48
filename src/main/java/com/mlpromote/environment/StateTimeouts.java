package com.mlpromote.environment;

import java.time.Duration;

/**
 * Maximum dwell time of each non-terminal promotion state in one environment.
 */
public record StateTimeouts(
        Duration deploy,
        Duration ready,
        Duration validation,
        Duration approval,
        Duration rollback) {
}
