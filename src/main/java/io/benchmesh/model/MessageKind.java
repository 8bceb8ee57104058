package io.benchmesh.model;

public enum MessageKind {
    QUERY,
    RESPONSE,
    BROADCAST
}
