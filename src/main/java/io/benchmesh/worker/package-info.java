/**
 * Worker contract and registry.
 *
 * <p>A {@link io.benchmesh.worker.Worker} answers bus queries by type: {@code propose} and
 * {@code revise} return a {@link io.benchmesh.worker.Proposal}, {@code validate} returns a
 * validation outcome, {@code vote} returns the chosen candidate or abstains.
 */
package io.benchmesh.worker;
