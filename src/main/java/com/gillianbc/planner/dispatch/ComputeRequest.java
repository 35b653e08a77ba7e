package com.gillianbc.planner.dispatch;

import lombok.NonNull;
import lombok.Value;

/**
 * A unit of work posted to the compute context.
 */
@Value
public class ComputeRequest {
    @NonNull
    String requestId;
    @NonNull
    MessageType type;
    Object params;
}
