/**
 * esquorum source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.esquorum.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.esquorum.cli.EsQuorumCommand} maps commands to runtime events.</li>
 *   <li>{@code io.esquorum.runtime.OperatorRuntime} wires collaborators and handles unit lifecycle events.</li>
 *   <li>{@code io.esquorum.reconcile.Reconciler} decides seed top-up, membership convergence and quorum writes.</li>
 * </ul>
 */
package io.esquorum;
