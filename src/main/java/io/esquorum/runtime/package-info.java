/**
 * Runtime wiring package.
 *
 * <p>{@link io.esquorum.runtime.OperatorRuntime} owns the unit lifecycle: it
 * refreshes the orchestrator's membership view, runs one reconciliation pass per
 * event, records the audit trail and reports unit health.
 */
package io.esquorum.runtime;
