package com.gillianbc.planner.dispatch;

import com.gillianbc.planner.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Delivers the messages of one request to the caller that made it. Once the result, an error,
 * a timeout or a cancellation has closed the channel, later messages are dropped.
 */
@Slf4j
final class ResponseChannel<T> {

    private final String requestId;
    private final MessageType completion;
    private final Class<T> resultType;
    private final Consumer<ProgressEvent> progress;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    ResponseChannel(String requestId, MessageType completion, Class<T> resultType, Consumer<ProgressEvent> progress) {
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.completion = completion;
        this.resultType = resultType;
        this.progress = progress;
        // a caller cancelling the future closes the channel too
        future.whenComplete((result, failure) -> closed.set(true));
    }

    CompletableFuture<T> future() {
        return future;
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * @return false when the message was dropped because it belongs to another request or the
     *         channel is already closed
     */
    boolean deliver(ComputeMessage message) {
        if (!requestId.equals(message.getRequestId()) || closed.get()) {
            log.debug("Dropping {} message for {}", message.getType().wireName(), message.getRequestId());
            return false;
        }
        MessageType type = message.getType();
        if (type == MessageType.PROGRESS) {
            if (progress != null) {
                progress.accept((ProgressEvent) message.getPayload());
            }
            return true;
        }
        if (type == MessageType.ERROR) {
            return fail((Throwable) message.getPayload());
        }
        if (type != completion) {
            throw new IllegalStateException("Request " + requestId + " expects " + completion.wireName()
                    + " but received " + type.wireName());
        }
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        return future.complete(resultType.cast(message.getPayload()));
    }

    boolean fail(Throwable failure) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        return future.completeExceptionally(failure);
    }
}
