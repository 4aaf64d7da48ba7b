package com.vmsentinel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Source of recorded samples. Implemented outside this library (database,
 * time-series store, remote API); the engine only consumes what it returns.
 *
 * @since 1.0.0
 */
public interface MetricStore {

    /**
     * Fetch the samples of one metric for one entity.
     *
     * @param entity monitored entity name
     * @param metric metric name
     * @param from   inclusive range start
     * @param to     inclusive range end
     * @return samples ordered by timestamp, possibly empty
     */
    List<Sample> fetch(String entity, String metric, Instant from, Instant to);
}
