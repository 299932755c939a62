package qg.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Governor settings.
 *
 * Resolution order for each value: environment variable, then the properties file named by the
 * {@code governor.properties} system property, then {@code /governor.properties} on the classpath,
 * then the built-in default.
 *
 * @param requestsPerHour hourly quota the gate enforces
 * @param maxRequestsPerHour ceiling imposed by the remote API; requestsPerHour may not exceed it
 * @param statusPort port of the diagnostic gRPC server
 */
public record GovernorConfig(
    double requestsPerHour,
    double maxRequestsPerHour,
    int statusPort
) {
    private static final Logger log = LoggerFactory.getLogger(GovernorConfig.class);

    public static final String RATE_PROPERTY = "governor.requestsPerHour";
    public static final String MAX_RATE_PROPERTY = "governor.maxRequestsPerHour";
    public static final String PORT_PROPERTY = "governor.statusPort";
    public static final String RATE_ENV = "RATE_LIMIT_PER_HOUR";
    public static final String MAX_RATE_ENV = "RATE_LIMIT_MAX_PER_HOUR";
    public static final String PORT_ENV = "GOVERNOR_STATUS_PORT";

    /** Leaves a safety margin under a 200 requests/hour remote quota. */
    public static final double DEFAULT_REQUESTS_PER_HOUR = 180;
    public static final double DEFAULT_MAX_REQUESTS_PER_HOUR = 200;
    public static final int DEFAULT_STATUS_PORT = 9090;

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    public GovernorConfig {
        if (!Double.isFinite(maxRequestsPerHour) || maxRequestsPerHour <= 0) {
            throw new IllegalArgumentException(
                "maxRequestsPerHour must be a positive finite number, got " + maxRequestsPerHour);
        }
        if (!Double.isFinite(requestsPerHour) || requestsPerHour <= 0) {
            throw new IllegalArgumentException(
                "requestsPerHour must be a positive finite number, got " + requestsPerHour);
        }
        if (requestsPerHour > maxRequestsPerHour) {
            throw new IllegalArgumentException(
                "requestsPerHour " + requestsPerHour + " exceeds the remote quota of " + maxRequestsPerHour);
        }
        if (statusPort < 0 || statusPort > 65_535) {
            throw new IllegalArgumentException("statusPort must be in [0, 65535], got " + statusPort);
        }
    }

    public static GovernorConfig defaults() {
        return new GovernorConfig(DEFAULT_REQUESTS_PER_HOUR, DEFAULT_MAX_REQUESTS_PER_HOUR, DEFAULT_STATUS_PORT);
    }

    /**
     * Loads configuration from the process environment and properties files.
     *
     * @throws IOException if an explicitly named properties file cannot be read
     * @throws IllegalArgumentException if any value is malformed or out of range
     */
    public static GovernorConfig load() throws IOException {
        return fromSources(loadProperties(), System.getenv());
    }

    /**
     * Builds a configuration from already loaded sources. Environment entries win over properties.
     */
    public static GovernorConfig fromSources(Properties props, Map<String, String> env) {
        double rate = parseDecimal(firstNonBlank(env.get(RATE_ENV), props.getProperty(RATE_PROPERTY)),
            RATE_PROPERTY, DEFAULT_REQUESTS_PER_HOUR);
        double max = parseDecimal(firstNonBlank(env.get(MAX_RATE_ENV), props.getProperty(MAX_RATE_PROPERTY)),
            MAX_RATE_PROPERTY, DEFAULT_MAX_REQUESTS_PER_HOUR);
        int port = parsePort(firstNonBlank(env.get(PORT_ENV), props.getProperty(PORT_PROPERTY)),
            PORT_PROPERTY, DEFAULT_STATUS_PORT);

        GovernorConfig config = new GovernorConfig(rate, max, port);
        log.info("Governor configured: {} requests/hour (remote quota {}), status port {}", rate, max, port);
        return config;
    }

    private static Properties loadProperties() throws IOException {
        Properties props = new Properties();
        String explicit = System.getProperty("governor.properties");
        if (explicit != null && !explicit.isBlank()) {
            Path path = Path.of(explicit);
            try (InputStream in = Files.newInputStream(path)) {
                props.load(in);
            }
            return props;
        }
        try (InputStream in = GovernorConfig.class.getResourceAsStream("/governor.properties")) {
            if (in == null) {
                log.debug("No governor.properties on classpath, using defaults");
                return props;
            }
            props.load(in);
            return props;
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }

    // rejects partial values such as "180/h" that a lenient parser would read as 180
    private static double parseDecimal(String raw, String key, double defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String v = raw.trim();
        if (!DECIMAL.matcher(v).matches()) {
            throw new IllegalArgumentException(
                "Invalid number \"" + v + "\" for " + key + ". Expected a positive decimal number.");
        }
        return Double.parseDouble(v);
    }

    private static int parsePort(String raw, String key, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String v = raw.trim();
        if (!DIGITS.matcher(v).matches() || v.length() > 5) {
            throw new IllegalArgumentException(
                "Invalid port \"" + v + "\" for " + key + ". Expected digits only.");
        }
        return Integer.parseInt(v);
    }
}
