package com.callplatform.guardsvc.infrastructure.store;

/**
 * Result of one atomic purge/count/conditional-insert batch.
 *
 * @param countBefore entries in the window before this call
 * @param countAfter  entries in the window after this call
 * @param oldestScore timestamp of the oldest entry still in the window
 */
public record SlidingWindowOutcome(long countBefore, long countAfter, long oldestScore) {

    public boolean admitted() {
        return countAfter > countBefore;
    }
}
