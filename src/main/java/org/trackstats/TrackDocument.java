package org.trackstats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Track data extracted from one source document: descriptive info, the point segments of all
 * its tracks and routes in document order, and the number of waypoints.
 */
public final class TrackDocument {

    private final Info info;
    private final List<List<TrackPoint>> segments;
    private final int waypoints;

    public TrackDocument(Info info, List<List<TrackPoint>> segments, int waypoints) {
        this.info = info != null ? info : new Info(null, null, null, null);
        List<List<TrackPoint>> copy = new ArrayList<>();
        for (List<TrackPoint> segment : segments) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(segment)));
        }
        this.segments = Collections.unmodifiableList(copy);
        this.waypoints = waypoints;
    }

    public TrackDocument(List<List<TrackPoint>> segments) {
        this(null, segments, 0);
    }

    public Info getInfo() {
        return info;
    }

    public List<List<TrackPoint>> getSegments() {
        return segments;
    }

    public int getWaypoints() {
        return waypoints;
    }

    public int getPointCount() {
        int count = 0;
        for (List<TrackPoint> segment : segments) {
            count += segment.size();
        }
        return count;
    }

    /** Name, description, author and copyright of the document; any of them may be null. */
    public static final class Info {
        private final String name;
        private final String description;
        private final String author;
        private final String copyright;

        public Info(String name, String description, String author, String copyright) {
            this.name = name;
            this.description = description;
            this.author = author;
            this.copyright = copyright;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        public String getAuthor() {
            return author;
        }

        public String getCopyright() {
            return copyright;
        }
    }
}
