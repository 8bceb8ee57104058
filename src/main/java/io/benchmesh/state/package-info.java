/**
 * Shared design state.
 *
 * <p>{@link io.benchmesh.state.SharedStateStore} is the only mutation gate: optimistic version
 * checks, path-scoped locks with TTL, a bounded change history, periodic snapshots for rollback
 * and debounced change notifications.
 */
package io.benchmesh.state;
