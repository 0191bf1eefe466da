package org.trackstats;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Application settings read from {@code trackstats.properties} on the classpath. System
 * properties with the same key take precedence.
 */
public final class AppConfig {

    public static final String RESOURCE = "trackstats.properties";

    static final String SERVER_PORT = "server.port";
    static final String KAFKA_BOOTSTRAP_SERVERS = "kafka.bootstrap.servers";
    static final String KAFKA_TOPIC = "kafka.topic";
    static final String UNITS = "trackstats.units";

    private final Properties props;

    AppConfig(Properties props) {
        this.props = props;
    }

    public static AppConfig load() {
        return load(RESOURCE, System.getProperties());
    }

    static AppConfig load(String resource, Properties overrides) {
        Properties props = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new TrackStatisticsException("Cannot read " + resource, e);
        }
        for (String key : overrides.stringPropertyNames()) {
            props.setProperty(key, overrides.getProperty(key));
        }
        return new AppConfig(props);
    }

    public TrackStatisticsOptions getOptions() {
        return TrackStatisticsOptions.fromProperties(props);
    }

    public int getServerPort() {
        String value = props.getProperty(SERVER_PORT, "5000").trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + SERVER_PORT + ": " + value, e);
        }
    }

    /** Kafka servers, or {@code null} when summaries are not published. */
    public String getKafkaBootstrapServers() {
        String value = props.getProperty(KAFKA_BOOTSTRAP_SERVERS, "").trim();
        return value.isEmpty() ? null : value;
    }

    public String getKafkaTopic() {
        return props.getProperty(KAFKA_TOPIC, "track_summary").trim();
    }

    public UnitSystem getUnits() {
        String value = props.getProperty(UNITS, "metric").trim().toUpperCase(Locale.ROOT);
        try {
            return UnitSystem.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + UNITS + ": " + value, e);
        }
    }
}
