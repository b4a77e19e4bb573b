package com.flinkcursor.runtime;

/**
 * Configuration constants for gateway polling.
 */
public final class PollingConfig {

    private PollingConfig() {} // Utility class

    /** Default wait between status probes and between page fetches */
    public static final long DEFAULT_FETCH_INTERVAL_MS = 100;

    /** System property overriding the fetch interval */
    public static final String PROP_FETCH_INTERVAL_MS = "flinkcursor.fetchIntervalMs";

    /**
     * Returns the fetch interval from system properties.
     *
     * @return the configured interval, or the default if unset or invalid
     */
    public static long configuredFetchIntervalMs() {
        String value = System.getProperty(PROP_FETCH_INTERVAL_MS);
        if (value != null) {
            try {
                return normalizeFetchInterval(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
        }
        return DEFAULT_FETCH_INTERVAL_MS;
    }

    /**
     * Validate and normalize a fetch interval.
     *
     * @param requested the requested interval in milliseconds
     * @return the interval, or the default for negative values
     */
    public static long normalizeFetchInterval(long requested) {
        return requested < 0 ? DEFAULT_FETCH_INTERVAL_MS : requested;
    }
}
