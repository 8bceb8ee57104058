package io.benchmesh.bus;

public record DeadLetter(
        String messageId,
        String fromWorker,
        String toWorker,
        String queryType,
        int attempts,
        String error,
        long deadAtMs
) {
}
