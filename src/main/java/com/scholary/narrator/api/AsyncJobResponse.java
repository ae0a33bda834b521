package com.scholary.narrator.api;

/**
 * Response for a conversion request.
 *
 * <p>Returns a job ID, the URL to poll for status and a Kibana URL for monitoring.
 */
public record AsyncJobResponse(String jobId, String statusUrl, String kibanaUrl) {}
