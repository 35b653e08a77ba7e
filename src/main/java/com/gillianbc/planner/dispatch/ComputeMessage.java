package com.gillianbc.planner.dispatch;

import lombok.NonNull;
import lombok.Value;

/**
 * A message from the compute context back to one caller. The payload is a
 * {@link com.gillianbc.planner.model.ProgressEvent} for progress, the failure for an error,
 * and the result otherwise.
 */
@Value
public class ComputeMessage {
    @NonNull
    String requestId;
    @NonNull
    MessageType type;
    Object payload;
}
