package com.storedsafe.lookup;

/**
 * Strategy for obtaining a new session once the current token is missing or
 * rejected.
 *
 * <h2>Contract</h2>
 * <ol>
 *   <li>Each attempt at a new token takes one unit from the shared {@link RetryBudget}.</li>
 *   <li>Failed attempts that may succeed on another try are retried inside the call
 *       while budget remains.</li>
 *   <li>The returned session is a new instance; {@code current} is never modified.</li>
 * </ol>
 *
 * @see TokenRefreshCoordinator
 */
public interface SessionRefresher {

    /**
     * Obtains a fresh session.
     *
     * @param config  the run's configuration
     * @param current the session whose token is missing or was rejected
     * @param budget  the run's shared refresh budget
     * @return a new session carrying a new token
     * @throws TokenUpdateScriptNotFoundException if no update script is available
     * @throws TokenUpdateFailedException         if the budget runs out
     * @throws TokenUpdateException               for other failures that end the run
     */
    Session refresh(Config config, Session current, RetryBudget budget) throws TokenUpdateException;
}
