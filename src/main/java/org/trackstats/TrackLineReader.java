package org.trackstats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads track samples written as one {@code Key: value} list per line, for example
 * <pre>
 * TrackName: Morning ride
 * Time: 2024-05-01T10:00:00Z, Latitude: 45.1, Longitude: 6.2, Elevation: 1200, HeartRate: 130
 * Segment
 * Waypoint: Summit
 * </pre>
 * A {@code Segment} line or a blank line ends the current segment. Lines starting with
 * {@code #} are ignored. The time accepts ISO-8601 instants or epoch milliseconds; a missing or
 * unreadable time becomes {@link TrackPoint#NO_TIME}. Non-finite numbers count as missing.
 */
public class TrackLineReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrackLineReader.class);

    /** Receives the content of the lines in reading order. */
    public interface Handler {
        void point(TrackPoint point);

        void segmentEnd();

        void waypoint(String name);

        void info(String key, String value);
    }

    public static final String TRACK_NAME = "trackname";
    public static final String DESCRIPTION = "description";
    public static final String AUTHOR = "author";
    public static final String COPYRIGHT = "copyright";

    /**
     * Reads a whole document.
     */
    public static TrackDocument read(Reader reader) throws IOException {
        DocumentCollector collector = new DocumentCollector();
        new TrackLineReader().readLines(reader, collector);
        return collector.toDocument();
    }

    public void readLines(Reader reader, Handler handler) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String inputLine;
        int lineNumber = 0;
        while ((inputLine = in.readLine()) != null) {
            lineNumber++;
            readLine(inputLine, lineNumber, handler);
        }
        handler.segmentEnd();
    }

    void readLine(String inputLine, int lineNumber, Handler handler) {
        String line = inputLine.trim();
        if (line.startsWith("#")) {
            return;
        }
        if (line.isEmpty() || line.equalsIgnoreCase("segment")) {
            handler.segmentEnd();
            return;
        }

        int colon = line.indexOf(':');
        String head = (colon < 0 ? line : line.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        String rest = colon < 0 ? "" : line.substring(colon + 1).trim();
        switch (head) {
            case "waypoint":
                handler.waypoint(rest);
                return;
            case TRACK_NAME:
            case DESCRIPTION:
            case AUTHOR:
            case COPYRIGHT:
                handler.info(head, rest);
                return;
            default:
                break;
        }

        TrackPoint point = parsePoint(line);
        if (point == null) {
            LOGGER.warn("Skipping line {} without latitude/longitude: {}", lineNumber, line);
            return;
        }
        handler.point(point);
    }

    /**
     * Parses a point line, or returns {@code null} when it has no usable coordinates.
     */
    TrackPoint parsePoint(String line) {
        Map<String, String> values = new HashMap<>();
        for (String part : line.split(",")) {
            int colon = part.indexOf(':');
            if (colon > 0) {
                String key = part.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                String value = part.substring(colon + 1).trim();
                values.put(key, value);
            }
        }

        Double latitude = parseDouble(first(values, "latitude", "lat"));
        Double longitude = parseDouble(first(values, "longitude", "lon"));
        if (latitude == null || longitude == null) {
            return null;
        }

        return TrackPoint.builder(latitude, longitude)
                .time(parseTime(first(values, "time", "timestamp")))
                .elevation(parseDouble(first(values, "elevation", "ele")))
                .heartRate(parseInteger(first(values, "heartrate", "hr")))
                .cadence(parseInteger(first(values, "cadence", "cad")))
                .temperature(parseDouble(first(values, "temperature", "atemp")))
                .name(values.get("name"))
                .build();
    }

    private static String first(Map<String, String> values, String... keys) {
        for (String key : keys) {
            String value = values.get(key);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    static Instant parseTime(String value) {
        if (value == null) {
            return TrackPoint.NO_TIME;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(value));
            }
            Instant time = Instant.parse(value);
            if (TrackPoint.hasMillisecondRange(time)) {
                return time;
            }
            LOGGER.debug("Time '{}' out of range, using {}", value, TrackPoint.NO_TIME);
            return TrackPoint.NO_TIME;
        } catch (DateTimeParseException | NumberFormatException e) {
            LOGGER.debug("Unreadable time '{}', using {}", value, TrackPoint.NO_TIME);
            return TrackPoint.NO_TIME;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            double number = Double.parseDouble(value);
            if (!Double.isFinite(number)) {
                LOGGER.debug("Ignoring non-finite number '{}'", value);
                return null;
            }
            return number;
        } catch (NumberFormatException e) {
            LOGGER.debug("Ignoring unreadable number '{}'", value);
            return null;
        }
    }

    private static Integer parseInteger(String value) {
        Double number = parseDouble(value);
        return number != null ? (int) Math.round(number) : null;
    }

    /**
     * Adds one info line. Repeated descriptions are joined line by line, the other keys keep the
     * last value.
     */
    static void mergeInfo(Map<String, String> info, String key, String value) {
        if (DESCRIPTION.equals(key)) {
            info.merge(key, value, (a, b) -> a + "\n" + b);
        } else {
            info.put(key, value);
        }
    }

    static TrackDocument.Info toInfo(Map<String, String> info) {
        return new TrackDocument.Info(info.get(TRACK_NAME), info.get(DESCRIPTION), info.get(AUTHOR), info.get(COPYRIGHT));
    }

    /** Builds a {@link TrackDocument} from the lines. */
    static final class DocumentCollector implements Handler {
        private final List<List<TrackPoint>> segments = new ArrayList<>();
        private final Map<String, String> info = new HashMap<>();
        private List<TrackPoint> current = new ArrayList<>();
        private int waypoints;

        @Override
        public void point(TrackPoint point) {
            current.add(point);
        }

        @Override
        public void segmentEnd() {
            if (!current.isEmpty()) {
                segments.add(current);
                current = new ArrayList<>();
            }
        }

        @Override
        public void waypoint(String name) {
            waypoints++;
        }

        @Override
        public void info(String key, String value) {
            mergeInfo(info, key, value);
        }

        TrackDocument toDocument() {
            segmentEnd();
            return new TrackDocument(toInfo(info), segments, waypoints);
        }
    }
}
