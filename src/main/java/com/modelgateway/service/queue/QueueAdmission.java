package com.modelgateway.service.queue;

/**
 * Outcome of offering a request to the queue.
 */
public record QueueAdmission(boolean accepted, int depth, String reason) {

    static QueueAdmission accepted(int depth) {
        return new QueueAdmission(true, depth, null);
    }

    static QueueAdmission rejected(int depth, String reason) {
        return new QueueAdmission(false, depth, reason);
    }
}
