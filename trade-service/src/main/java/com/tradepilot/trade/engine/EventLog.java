package com.tradepilot.trade.engine;

import com.tradepilot.trade.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Bounded activity log. Keeps the last {@code engine.event-capacity} events and
 * pushes each new one to live subscribers.
 */
@Component
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final int capacity;
    private final Clock clock;
    private final Deque<EngineEvent> recent = new ArrayDeque<>();
    // autoCancel off: the sink must outlive any single stream subscriber
    private final Sinks.Many<EngineEvent> sink = Sinks.many().multicast().onBackpressureBuffer(64, false);
    private long sequence;

    public EventLog(EngineProperties properties, Clock clock) {
        this.capacity = Math.max(1, properties.getEventCapacity());
        this.clock    = clock;
    }

    public synchronized EngineEvent append(EventType type, String message) {
        EngineEvent event = new EngineEvent(++sequence, clock.instant(), type, message);
        recent.addLast(event);
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.debug("[EventLog] Live emit skipped. id={} result={}", event.id(), result);
        }
        return event;
    }

    public EngineEvent info(String message)     { return append(EventType.INFO, message); }
    public EngineEvent success(String message)  { return append(EventType.SUCCESS, message); }
    public EngineEvent warning(String message)  { return append(EventType.WARNING, message); }
    public EngineEvent advisory(String message) { return append(EventType.ADVISORY, message); }

    /** Retained events, newest first. */
    public synchronized List<EngineEvent> recent() {
        List<EngineEvent> copy = new ArrayList<>(recent);
        Collections.reverse(copy);
        return copy;
    }

    public Flux<EngineEvent> stream() {
        return sink.asFlux();
    }
}
