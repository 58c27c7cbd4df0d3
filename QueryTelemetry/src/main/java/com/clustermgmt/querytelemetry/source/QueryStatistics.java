package com.clustermgmt.querytelemetry.source;

/**
 * Execution statistics reported for one raw statement text.
 * Times are in milliseconds; min/max/mean may be null when the source does not report them.
 */
public record QueryStatistics(long calls, double totalTime, Double minTime, Double maxTime, Double meanTime) {
}
