package com.questrail.synop.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SynopObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onReport(SynopReportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onWarning(SynopWarningEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(SynopErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<SynopWarningEvent> getWarnings() {
        return ofType(SynopWarningEvent.class);
    }

    public synchronized List<SynopReportEvent> getReports() {
        return ofType(SynopReportEvent.class);
    }

    public synchronized List<SynopErrorEvent> getErrors() {
        return ofType(SynopErrorEvent.class);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
