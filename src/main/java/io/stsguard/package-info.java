/**
 * StsGuard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.stsguard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.stsguard.cli.StsGuardCommand} maps commands to the orchestrator.</li>
 *   <li>{@code io.stsguard.runtime.SafeApplyOrchestrator} decides between in-place apply and recreation.</li>
 *   <li>{@code io.stsguard.kube} adapts the cluster collaborators to the fabric8 client.</li>
 * </ul>
 */
package io.stsguard;
