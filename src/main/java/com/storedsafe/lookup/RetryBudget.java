package com.storedsafe.lookup;

import com.storedsafe.client.Preconditions;

/**
 * Counts token refresh attempts across one whole lookup run.
 *
 * <p>One instance is shared by every term of a run, so a run never makes more than
 * {@link #getMaxAttempts()} refresh attempts in total. Not thread-safe; a run is
 * single-threaded.
 */
public final class RetryBudget {

    /** Refresh attempts allowed per run. */
    public static final int MAX_RETRIES = 5;

    private final int maxAttempts;
    private int used;

    public RetryBudget() {
        this(MAX_RETRIES);
    }

    public RetryBudget(int maxAttempts) {
        this.maxAttempts = Preconditions.requirePositive(maxAttempts, "Max attempts");
    }

    /**
     * Takes one attempt from the budget.
     *
     * @return false if the budget is already used up
     */
    public boolean tryConsume() {
        if (used >= maxAttempts) {
            return false;
        }
        used++;
        return true;
    }

    public int getUsed() {
        return used;
    }

    public int getRemaining() {
        return maxAttempts - used;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isExhausted() {
        return used >= maxAttempts;
    }
}
