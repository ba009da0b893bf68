package io.gridsweep.observability;

import java.util.List;

/**
 * Destination for sweep events. Components receive a sink through their
 * constructor; there is no process-wide logger.
 */
@FunctionalInterface
public interface EventSink {
    EventSink NOOP = event -> {
    };

    void emit(SweepEvent event);

    static EventSink composite(EventSink... sinks) {
        List<EventSink> targets = List.of(sinks);
        return event -> {
            for (EventSink sink : targets) {
                sink.emit(event);
            }
        };
    }
}
