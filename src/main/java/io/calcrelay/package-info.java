/**
 * calcrelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.calcrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.calcrelay.cli.CalcRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.calcrelay.runner.CalcJobRunner} claims calcjobs and drives them with bounded concurrency.</li>
 *   <li>{@code io.calcrelay.engine.ProcessEngine} executes and commits one step at a time.</li>
 *   <li>{@code io.calcrelay.storage.MetadataStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.calcrelay;
