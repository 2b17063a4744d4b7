package io.practicedb.core.sync;

/**
 * Counters for one sync pass.
 *
 * @param conflicts    pushes that failed and stay pending
 * @param skipped      pulled changes the conflict policy kept local
 * @param failedPulls  collections whose changes feed could not be read
 */
public record SyncResult(int pushed, int pulled, int conflicts, int skipped, int failedPulls) {
}
