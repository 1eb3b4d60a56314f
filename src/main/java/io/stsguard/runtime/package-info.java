/**
 * Safe-apply orchestration.
 *
 * <p>{@link io.stsguard.runtime.SafeApplyOrchestrator} owns the per-identity state machine and the
 * operation record; {@link io.stsguard.runtime.IdentityLocks} keeps runs for one workload
 * serialized across threads and processes.
 */
package io.stsguard.runtime;
