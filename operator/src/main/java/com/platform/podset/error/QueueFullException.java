package com.platform.podset.error;

public class QueueFullException extends OperatorException {

    public QueueFullException(String key, int capacity) {
        super(ErrorCode.QUEUE_FULL,
            String.format("Cannot enqueue %s: work queue is at capacity %d", key, capacity));
    }
}
