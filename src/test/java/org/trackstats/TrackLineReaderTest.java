package org.trackstats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TrackLineReaderTest {

    private static final String TRACK = String.join("\n",
            "# exported track",
            "TrackName: Morning ride",
            "Author: Alice",
            "Description: first line",
            "Description: second line",
            "Time: 2024-05-01T10:00:00Z, Latitude: 45.1, Longitude: 6.2, Elevation: 1200, HeartRate: 130, Cadence: 80, Temperature: 18.5",
            "Time: 1714557605000, Latitude: 45.1001, Longitude: 6.2001, Elevation: 1202.5",
            "Segment",
            "Time: yesterday, Latitude: 45.1002, Longitude: 6.2002, Name: Summit",
            "",
            "",
            "Time: 2024-05-01T10:00:15Z, Latitude: oops, Longitude: 6.2003",
            "Waypoint: Hut",
            "Waypoint: Lake",
            "lat: 45.1003, lon: 6.2003, ele: abc, hr: 141.6");

    @Test
    void readsSegmentsPointsAndInfo() throws IOException {
        TrackDocument document = TrackLineReader.read(new StringReader(TRACK));

        assertThat(document.getSegments()).hasSize(3);
        assertThat(document.getSegments().get(0)).hasSize(2);
        assertThat(document.getSegments().get(1)).hasSize(1);
        assertThat(document.getSegments().get(2)).hasSize(1);
        assertThat(document.getPointCount()).isEqualTo(4);
        assertThat(document.getWaypoints()).isEqualTo(2);
        assertThat(document.getInfo().getName()).isEqualTo("Morning ride");
        assertThat(document.getInfo().getAuthor()).isEqualTo("Alice");
        assertThat(document.getInfo().getDescription()).isEqualTo("first line\nsecond line");
        assertThat(document.getInfo().getCopyright()).isNull();
    }

    @Test
    void parsesAllPointFields() throws IOException {
        TrackDocument document = TrackLineReader.read(new StringReader(TRACK));
        TrackPoint first = document.getSegments().get(0).get(0);
        TrackPoint second = document.getSegments().get(0).get(1);

        assertThat(first.getTime()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(first.getLatitude()).isEqualTo(45.1);
        assertThat(first.getLongitude()).isEqualTo(6.2);
        assertThat(first.getElevation()).isEqualTo(1200.0);
        assertThat(first.getHeartRate()).isEqualTo(130);
        assertThat(first.getCadence()).isEqualTo(80);
        assertThat(first.getTemperature()).isEqualTo(18.5);
        assertThat(second.getTime()).isEqualTo(Instant.parse("2024-05-01T10:00:05Z"));
        assertThat(second.getHeartRate()).isNull();
    }

    @Test
    void unreadableValuesBecomeMissing() throws IOException {
        TrackDocument document = TrackLineReader.read(new StringReader(TRACK));
        TrackPoint named = document.getSegments().get(1).get(0);
        TrackPoint shortKeys = document.getSegments().get(2).get(0);

        assertThat(named.getTime()).isEqualTo(TrackPoint.NO_TIME);
        assertThat(named.getName()).isEqualTo("Summit");
        assertThat(shortKeys.getElevation()).isNull();
        assertThat(shortKeys.getHeartRate()).isEqualTo(142);
        assertThat(shortKeys.getTime()).isEqualTo(TrackPoint.NO_TIME);
    }

    @Test
    void emptyInputGivesEmptyDocument() throws IOException {
        TrackDocument document = TrackLineReader.read(new StringReader("\n\n"));

        assertThat(document.getSegments()).isEmpty();
        assertThat(TrackStatisticsAggregator.compute(document, TrackStatisticsOptions.defaults()).isEmpty()).isTrue();
    }

    @Test
    void timeBeyondMillisecondRangeBecomesNoTime() throws IOException {
        String lines = String.join("\n",
                "Time: 2024-05-01T10:00:00Z, Latitude: 45.0, Longitude: 6.0",
                "Time: +300000000-01-01T00:00:00Z, Latitude: 45.0005, Longitude: 6.0005");

        TrackDocument document = TrackLineReader.read(new StringReader(lines));
        TrackStatistics stats = TrackStatisticsAggregator.compute(document, TrackStatisticsOptions.defaults());

        assertThat(document.getSegments().get(0).get(1).getTime()).isEqualTo(TrackPoint.NO_TIME);
        assertThat(stats.getPointCount()).isEqualTo(2);
        assertThat(stats.getDistance()).isPositive();
    }

    @Test
    void nonFiniteNumbersAreExcluded() throws IOException {
        String lines = String.join("\n",
                "Time: 2024-05-01T10:00:00Z, Latitude: 45.0, Longitude: 6.0, Elevation: 1000, Temperature: 20",
                "Time: 2024-05-01T10:00:05Z, Latitude: 45.0005, Longitude: 6.0005, Elevation: Infinity, Temperature: NaN",
                "Time: 2024-05-01T10:00:10Z, Latitude: NaN, Longitude: 6.001, Elevation: 1010",
                "Time: 2024-05-01T10:00:15Z, Latitude: 45.0015, Longitude: -Infinity",
                "Time: 2024-05-01T10:00:20Z, Latitude: 45.002, Longitude: 6.002, Elevation: 1012, HeartRate: NaN");

        TrackDocument document = TrackLineReader.read(new StringReader(lines));
        TrackStatistics stats = TrackStatisticsAggregator.compute(document, TrackStatisticsOptions.defaults());

        assertThat(document.getPointCount()).isEqualTo(3);
        TrackPoint noisy = document.getSegments().get(0).get(1);
        assertThat(noisy.getElevation()).isNull();
        assertThat(noisy.getTemperature()).isNull();
        assertThat(document.getSegments().get(0).get(2).getHeartRate()).isNull();

        assertThat(stats.getDistance()).isFinite().isPositive();
        assertThat(stats.getElevationMax()).hasValue(1012.0);
        assertThat(stats.getElevationGain()).isEqualTo(12.0);
        assertThat(stats.getVelocityMax().getAsDouble()).isFinite();
        assertThat(stats.getAverageTemperature().getAsDouble()).isCloseTo(20.0 / 3, within(1e-12));
        assertThat(stats.getAverageHeartRate()).isEmpty();
    }
}
