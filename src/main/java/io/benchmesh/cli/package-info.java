/**
 * picocli command line. Every subcommand builds a fresh {@link io.benchmesh.coordinator.DesignSession}
 * from a JSON script and closes it before exiting.
 */
package io.benchmesh.cli;
