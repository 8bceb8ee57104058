package io.benchmesh.worker;

import java.util.List;

public record WorkerContext(
        String turnId,
        String messageId,
        String fromWorker,
        List<String> callChain,
        BusClient bus
) {
    public WorkerContext {
        callChain = callChain == null ? List.of() : List.copyOf(callChain);
    }
}
