package com.storedsafe.lookup;

import com.storedsafe.client.FetchOutcome;
import com.storedsafe.client.StoredSafeException;
import com.storedsafe.client.StoredSafeHttpClient;
import com.storedsafe.client.VerifyMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up values in StoredSafe for a host automation runtime.
 *
 * <p>Each call to {@link #run(List, Map)} is one independent lookup:
 * <ol>
 *   <li>parse the terms and resolve the configuration,</li>
 *   <li>authenticate: check the token, refreshing it with the update script until
 *       the server accepts it,</li>
 *   <li>fetch each term in order. A 403 refreshes the token, authenticates again and
 *       fetches the same term again; any other failure ends the run.</li>
 * </ol>
 * All token refreshes of a run share one {@link RetryBudget} of
 * {@value RetryBudget#MAX_RETRIES} attempts. Either every term resolves or the run
 * fails; partial results are never returned.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * List<String> values = new StoredSafeLookup().run(
 *         List.of("628/username", "628/password"), hostVariables);
 * }</pre>
 */
public class StoredSafeLookup {

    private static final Logger logger = LoggerFactory.getLogger(StoredSafeLookup.class);

    private final Map<String, String> env;
    private final ConfigResolver configResolver;
    private final StoredSafeHttpClient client;
    private final SessionRefresher refresher;

    public StoredSafeLookup() {
        this(System.getenv(), new ConfigResolver(), new StoredSafeHttpClient(), new TokenRefreshCoordinator());
    }

    /**
     * @param env            environment variables to resolve the configuration from
     * @param configResolver builds the configuration
     * @param client         talks to StoredSafe
     * @param refresher      obtains new tokens
     */
    public StoredSafeLookup(Map<String, String> env, ConfigResolver configResolver,
                            StoredSafeHttpClient client, SessionRefresher refresher) {
        this.env = env;
        this.configResolver = configResolver;
        this.client = client;
        this.refresher = refresher;
    }

    /**
     * Resolves every term.
     *
     * @param terms         terms of the form {@code <objectid>/<fieldname>}
     * @param frameworkVars variables supplied by the host runtime, may be null
     * @return one value per term, in term order, with trailing whitespace removed
     * @throws StoredSafeException if any term cannot be resolved; the exception's
     *                             phase tells where the run stopped
     */
    public List<String> run(List<String> terms, Map<String, ?> frameworkVars) throws StoredSafeException {
        logger.debug("StoredSafe lookup initial terms is {}", terms);

        List<LookupTerm> lookupTerms = new ArrayList<>(terms.size());
        for (String term : terms) {
            lookupTerms.add(LookupTerm.parse(term));
        }

        Config config = configResolver.resolve(env, frameworkVars);
        RetryBudget budget = new RetryBudget();
        Session session = authenticate(config, Session.initial(config), budget);

        List<String> results = new ArrayList<>(lookupTerms.size());
        for (LookupTerm term : lookupTerms) {
            logger.debug("StoredSafe lookup using {}", term);
            while (true) {
                FetchOutcome outcome = client.fetchObject(session.getBaseUrl(), session.getToken(),
                        term.getObjectId(), term.getFieldName(), config.getVerifyMode());

                if (outcome.getKind() == FetchOutcome.Kind.SUCCESS) {
                    logger.debug("Successfully retrieved {}", term);
                    results.add(outcome.getValue().stripTrailing());
                    break;
                }
                if (outcome.getKind() != FetchOutcome.Kind.TOKEN_REJECTED) {
                    throw new FetchFailedException(term, outcome);
                }

                logger.debug("Token rejected when retrieving {}, updating token and retrying", term);
                session = authenticate(config, refresher.refresh(config, session, budget), budget);
            }
        }

        logger.debug("StoredSafe lookup resolved {} term(s) using {} token update(s)",
                results.size(), budget.getUsed());
        return Collections.unmodifiableList(results);
    }

    /**
     * Returns a session whose token passed the auth check, refreshing as needed.
     */
    private Session authenticate(Config config, Session session, RetryBudget budget) throws StoredSafeException {
        VerifyMode verifyMode = config.getVerifyMode();
        Session current = session;
        while (true) {
            if (!current.hasToken()) {
                logger.debug("No StoredSafe token available, running token update");
            } else if (client.authCheck(current.getBaseUrl(), current.getToken(), verifyMode)) {
                logger.debug("Token auth check success");
                return current;
            } else {
                logger.debug("Token auth check failed, running token update");
            }
            current = refresher.refresh(config, current, budget);
        }
    }
}
