package com.mlpromote.promotion;

/**
 * Receives orchestrator events. Delivery is fire-and-forget: a failing sink is logged and never
 * affects a run.
 */
@FunctionalInterface
public interface NotificationSink {
    void publish(PromotionEvent event);
}
