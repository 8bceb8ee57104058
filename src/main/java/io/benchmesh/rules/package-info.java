/**
 * Design rules.
 *
 * <p>Each {@link io.benchmesh.rules.Rule} decides whether it applies to a document, evaluates it
 * and may supply a pure fix. Numeric limits come from {@link io.benchmesh.rules.FurnitureKnowledge}.
 */
package io.benchmesh.rules;
