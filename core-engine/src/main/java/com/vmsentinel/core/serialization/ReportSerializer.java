package com.vmsentinel.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vmsentinel.core.model.Alert;
import com.vmsentinel.core.model.GapReport;
import com.vmsentinel.core.model.StatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Converts analysis results to JSON for presentation layers.
 *
 * <p>
 * Property names are snake_case ({@code completeness_percentage},
 * {@code missing_intervals}, ...) and instants are ISO-8601 strings. Alerts
 * use the fixed shape {@code {server, rule, value, threshold, severity,
 * timestamp, message}}.
 * </p>
 *
 * <p>
 * Instances are thread-safe once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportSerializer.class);

    private final ObjectMapper mapper;

    public ReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public String toJson(StatusReport report) {
        return write(report);
    }

    public String toJson(GapReport report) {
        return write(report);
    }

    public String toJson(Alert alert) {
        return write(alert);
    }

    public String toJson(List<Alert> alerts) {
        return write(alerts);
    }

    /**
     * @return the configured mapper, for callers embedding results in larger documents
     */
    public ObjectMapper mapper() {
        return mapper;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", value.getClass().getSimpleName(), e.getMessage(), e);
            throw new UncheckedIOException(e);
        }
    }
}
