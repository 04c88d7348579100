/**
 * SyncLane source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.synclane.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.synclane.cli.SyncLaneCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.synclane.runtime.SyncLaneRuntime} owns per-repository lock handles and collaborators.</li>
 *   <li>{@code io.synclane.sync.SyncOrchestrator} runs commit, fetch, merge, reconcile and push.</li>
 *   <li>{@code io.synclane.lock.SyncLockManager} is the cross-process sync lock with heartbeat liveness.</li>
 * </ul>
 */
package io.synclane;
