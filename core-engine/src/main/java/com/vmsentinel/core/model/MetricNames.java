package com.vmsentinel.core.model;

/**
 * Well-known metric series names used by the default rule catalogue.
 *
 * @since 1.0.0
 */
public final class MetricNames {

    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String CPU_READY_SUMMATION = "cpu_ready_summation";
    public static final String DISK_LATENCY = "disk_latency";

    /** Raw inbound network throughput in Mbps. */
    public static final String NETWORK_IN_MBPS = "network_in_mbps";

    /** Inbound throughput as a percentage of link capacity; derived from {@link #NETWORK_IN_MBPS}. */
    public static final String NETWORK_USAGE_PERCENT = "network_usage_percent";

    private MetricNames() {
        // constants only
    }
}
