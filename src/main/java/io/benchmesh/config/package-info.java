/**
 * Runtime root layout and tunables.
 *
 * <p>{@link io.benchmesh.config.BenchMeshSettings} is read from {@code benchmesh-settings.json};
 * absent or out-of-range fields fall back to the {@code DEFAULT_*} constants of
 * {@link io.benchmesh.config.BenchMeshConfig}.
 */
package io.benchmesh.config;
