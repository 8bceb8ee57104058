/**
 * Immutable data model shared by the bus, the state store and the coordinator.
 * Document and constraint trees are Jackson object nodes that never leave their owner uncopied.
 */
package io.benchmesh.model;
