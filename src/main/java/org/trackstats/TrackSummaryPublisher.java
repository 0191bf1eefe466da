package org.trackstats;

import com.google.gson.Gson;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Publishes track summaries as JSON records on a Kafka topic, keyed by track name.
 */
public class TrackSummaryPublisher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackSummaryPublisher.class);

    static final String UNNAMED_KEY = "unnamed";

    private final Producer<String, String> producer;
    private final String topic;
    private final Gson gson = new Gson();

    public TrackSummaryPublisher(Producer<String, String> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    public static Producer<String, String> createProducer(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return new KafkaProducer<>(props);
    }

    public String toJson(TrackSummary summary) {
        return gson.toJson(summary);
    }

    public void publish(TrackSummary summary) {
        String key = summary.getName() != null ? summary.getName() : UNNAMED_KEY;
        String message = toJson(summary);
        producer.send(new ProducerRecord<>(topic, key, message), (metadata, exception) -> {
            if (exception != null) {
                LOGGER.warn("Failed to publish summary of track {} to {}", key, topic, exception);
            } else {
                LOGGER.debug("Published summary of track {} to {}", key, topic);
            }
        });
    }

    @Override
    public void close() {
        producer.close();
    }
}
