/**
 * TaskMaster source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskmaster.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskmaster.cli.TaskMasterCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.taskmaster.runtime.TaskMasterRuntime} orchestrates runs, workers, retries and schedules.</li>
 *   <li>{@code io.taskmaster.storage.RunStore} is the authoritative run/task persistence layer.</li>
 *   <li>{@code io.taskmaster.identity.IdentityEngine} decides what a rescan has to write.</li>
 * </ul>
 */
package io.taskmaster;
