package com.glossary.mapping.event;

import com.glossary.mapping.core.model.MappingStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every mapping event. Matches go to DEBUG; everything needing attention goes to INFO.
 */
public class LoggingMappingEventListener implements MappingEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingMappingEventListener.class);

    @Override
    public void onMapping(MappingEvent event) {
        if (event.status() == MappingStatus.MATCHED && !event.degraded()) {
            log.debug("mapping.record sourceId={} status={} confidence={} path={} latencyMs={} generation={}",
                    event.sourceId(), event.status(), event.confidence(), event.decisionPath(),
                    event.latency().toMillis(), event.generationId());
        } else {
            log.info("mapping.record sourceId={} status={} confidence={} path={} latencyMs={} generation={} degraded={}",
                    event.sourceId(), event.status(), event.confidence(), event.decisionPath(),
                    event.latency().toMillis(), event.generationId(), event.degraded());
        }
    }
}
