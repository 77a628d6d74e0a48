package com.mlpromote.promotion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void publish(PromotionEvent event) {
        switch (event.type()) {
            case TRANSITION -> log.debug("promotion.event.transition runId={} environment={} from={} to={}",
                    event.runId(), event.environment(), event.from(), event.to());
            case APPROVAL_REQUESTED -> log.info("promotion.event.approval-requested runId={} artifact={} environment={} detail={}",
                    event.runId(), event.artifactVersionId(), event.environment(), event.detail());
            case PROMOTION_SUCCEEDED -> log.info("promotion.event.succeeded runId={} artifact={} environment={}",
                    event.runId(), event.artifactVersionId(), event.environment());
            case PROMOTION_FAILED -> log.warn("promotion.event.failed runId={} artifact={} environment={} state={} detail={}",
                    event.runId(), event.artifactVersionId(), event.environment(), event.to(), event.detail());
            case ROLLBACK_FAILED -> log.error("promotion.event.rollback-failed runId={} artifact={} environment={} detail={} action=manual-intervention-required",
                    event.runId(), event.artifactVersionId(), event.environment(), event.detail());
        }
    }
}
