package org.trackstats;

import com.espertech.esper.runtime.client.EPRuntime;
import org.apache.kafka.clients.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Prints the statistics of a track file, or, without arguments, of every track streamed to the
 * socket server (one document per connection).
 */
public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        AppConfig config = AppConfig.load();
        TrackSummaryPublisher publisher = createPublisher(config);
        int status = 0;
        try {
            if (args.length > 0) {
                summarizeFile(Path.of(args[0]), config, publisher);
            } else {
                EPRuntime runtime = TrackStatisticsStream.createRuntime("trackstats");
                startSocketServer(runtime, config, publisher);
            }
        } catch (IOException e) {
            LOGGER.error("Cannot read track: {}", e.getMessage());
            status = 1;
        } finally {
            if (publisher != null) {
                publisher.close();
            }
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    private static TrackSummaryPublisher createPublisher(AppConfig config) {
        String servers = config.getKafkaBootstrapServers();
        if (servers == null) {
            return null;
        }
        Producer<String, String> producer = TrackSummaryPublisher.createProducer(servers);
        return new TrackSummaryPublisher(producer, config.getKafkaTopic());
    }

    static void summarizeFile(Path file, AppConfig config, TrackSummaryPublisher publisher) throws IOException {
        TrackDocument document;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            document = TrackLineReader.read(reader);
        }
        LOGGER.info("Read {} points in {} segments from {}", document.getPointCount(), document.getSegments().size(), file);
        TrackStatistics stats = TrackStatisticsAggregator.compute(document, config.getOptions());
        report(stats, config, publisher);
    }

    private static void report(TrackStatistics stats, AppConfig config, TrackSummaryPublisher publisher) {
        TrackSummary summary = TrackSummary.of(stats, config.getUnits());
        System.out.println(summary.toText());
        if (publisher != null) {
            publisher.publish(summary);
        }
    }

    private static void startSocketServer(EPRuntime runtime, AppConfig config, TrackSummaryPublisher publisher) {
        int port = config.getServerPort();
        try (ServerSocket serverSocket = new ServerSocket(port)) {
            LOGGER.info("Server is listening on port {}", port);
            while (!Thread.currentThread().isInterrupted()) {
                try (Socket clientSocket = serverSocket.accept();
                     Reader reader = new InputStreamReader(clientSocket.getInputStream(), StandardCharsets.UTF_8)) {
                    TrackStatistics stats = streamDocument(runtime, reader, config.getOptions());
                    report(stats, config, publisher);
                } catch (IOException | TrackStatisticsException e) {
                    LOGGER.warn("Error handling client: {}", e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            LOGGER.error("Server socket error: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs the lines of one document through an Esper stream and returns the finished statistics.
     */
    static TrackStatistics streamDocument(EPRuntime runtime, Reader reader, TrackStatisticsOptions options) throws IOException {
        TrackStatisticsAggregator aggregator = new TrackStatisticsAggregator(options);
        TrackStatisticsStream stream = new TrackStatisticsStream(runtime, aggregator);
        Map<String, String> info = new HashMap<>();
        stream.start();
        try {
            new TrackLineReader().readLines(reader, new TrackLineReader.Handler() {
                @Override
                public void point(TrackPoint point) {
                    stream.send(point);
                }

                @Override
                public void segmentEnd() {
                    // segments do not break the statistics
                }

                @Override
                public void waypoint(String name) {
                    aggregator.getStatistics().incrementWaypoints();
                }

                @Override
                public void info(String key, String value) {
                    TrackLineReader.mergeInfo(info, key, value);
                }
            });
        } catch (IOException e) {
            stream.finish();
            throw e;
        } finally {
            aggregator.getStatistics().setInfo(TrackLineReader.toInfo(info));
        }
        return stream.finish();
    }
}
