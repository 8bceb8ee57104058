/**
 * Turn orchestration.
 *
 * <p>{@link io.benchmesh.coordinator.DesignSession} wires one store, one bus and one
 * {@link io.benchmesh.coordinator.Coordinator} per conversation. A turn runs the planned workers
 * in dependency order, commits each proposal, applies rule fixes or escalates conflicts after every
 * commit, then validates and offers variations of a valid design.
 */
package io.benchmesh.coordinator;
