package com.questrail.synop.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SynopObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSynopObservabilitySink implements SynopObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSynopObservabilitySink.class);

    @Override
    public void onReport(SynopReportEvent event) {
        if (!event.notImplemented().isEmpty()) {
            log.info("SYNOP {} with {} group(s) not implemented: {}",
                event.direction(),
                event.notImplemented().size(),
                event.notImplemented());
        }
        log.debug("SYNOP {} ({} fields): {}",
            event.direction(),
            event.fieldCount(),
            event.telegram());
    }

    @Override
    public void onWarning(SynopWarningEvent event) {
        if (event.group() != null) {
            log.warn("SYNOP Warning in group {}: {}", event.group(), event.message());
        } else {
            log.warn("SYNOP Warning: {}", event.message());
        }
    }

    @Override
    public void onError(SynopErrorEvent event) {
        log.error("SYNOP Error: {}", event.message(), event.cause());
    }
}
