package io.benchmesh.bus;

import io.benchmesh.model.Message;

import java.util.Comparator;

record QueuedMessage(Message message, int attempt, long sequence) {
    static final Comparator<QueuedMessage> DISPATCH_ORDER = Comparator
            .comparingInt((QueuedMessage q) -> -q.message().priority().weight())
            .thenComparingLong(QueuedMessage::sequence);

    QueuedMessage retry(long nextSequence) {
        return new QueuedMessage(message, attempt + 1, nextSequence);
    }
}
