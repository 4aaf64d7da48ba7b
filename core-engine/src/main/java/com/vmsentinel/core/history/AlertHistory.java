package com.vmsentinel.core.history;

import com.vmsentinel.core.config.AnalysisSettings;
import com.vmsentinel.core.model.Alert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded log of alerts in arrival order.
 *
 * <p>
 * Owned by the caller: the classifier never records into it. When full, the
 * oldest alerts are evicted first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All methods are synchronized on the instance.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertHistory {

    /** Number of alerts returned by {@link #recent()}. */
    public static final int DEFAULT_LIMIT = 100;

    private final int capacity;
    private final Deque<Alert> alerts = new ArrayDeque<>();

    public AlertHistory() {
        this(AnalysisSettings.defaults().getAlertHistoryCapacity());
    }

    public AlertHistory(AnalysisSettings settings) {
        this(settings.getAlertHistoryCapacity());
    }

    /**
     * @param capacity maximum number of alerts retained
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public AlertHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append alerts, evicting the oldest ones beyond capacity.
     *
     * @param newAlerts alerts to record, in order
     */
    public synchronized void record(Collection<Alert> newAlerts) {
        Objects.requireNonNull(newAlerts, "alerts must not be null");
        for (Alert alert : newAlerts) {
            alerts.addLast(Objects.requireNonNull(alert, "alert must not be null"));
            if (alerts.size() > capacity) {
                alerts.pollFirst();
            }
        }
    }

    /**
     * @return the {@value #DEFAULT_LIMIT} most recent alerts, oldest first
     */
    public List<Alert> recent() {
        return recent(DEFAULT_LIMIT);
    }

    /**
     * @param limit maximum number of alerts to return
     * @return the most recent {@code limit} alerts, oldest first
     * @throws IllegalArgumentException if {@code limit < 0}
     */
    public synchronized List<Alert> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        int count = Math.min(limit, alerts.size());
        List<Alert> result = new ArrayList<>(count);
        Iterator<Alert> newestFirst = alerts.descendingIterator();
        while (result.size() < count) {
            result.add(0, newestFirst.next());
        }
        return List.copyOf(result);
    }

    public synchronized int size() {
        return alerts.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        alerts.clear();
    }
}
