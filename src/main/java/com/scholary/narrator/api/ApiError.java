package com.scholary.narrator.api;

import java.time.Instant;

/** Standardized error response for API clients. */
public record ApiError(String error, String message, String details, Instant timestamp) {}
