package com.openforge.memoria.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Aggregate status pushed to /topic/processing-status. */
public record ProcessingStatusEvent(
        @JsonProperty("is_processing") boolean isProcessing,
        @JsonProperty("queue_depth")   long queueDepth
) {}
