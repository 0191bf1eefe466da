package org.trackstats;

/**
 * Failure of the infrastructure around the statistics pass (event runtime, publishing).
 */
public class TrackStatisticsException extends RuntimeException {

    public TrackStatisticsException(String message) {
        super(message);
    }

    public TrackStatisticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
