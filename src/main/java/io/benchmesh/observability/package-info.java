/**
 * Audit trail, Prometheus text exposition and id generation.
 *
 * <p>{@link io.benchmesh.observability.AuditLogger} appends one JSON line per event and chains
 * each line to the previous one with a SHA-256 hash, so a truncated or edited log is detectable.
 */
package io.benchmesh.observability;
