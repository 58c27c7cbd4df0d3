package com.clustermgmt.querytelemetry.dto;

/**
 * Outcome of ingesting one raw statement.
 */
public record IngestResult(long canonicalQueryId, boolean newCanonical, boolean newSample) {
}
