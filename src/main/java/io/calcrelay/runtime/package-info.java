/**
 * Project-level facade.
 *
 * <p>{@link io.calcrelay.runtime.CalcRelayRuntime} opens one project directory
 * and wires storage, the audit log and runners for the CLI.
 */
package io.calcrelay.runtime;
