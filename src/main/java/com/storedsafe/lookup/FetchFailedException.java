package com.storedsafe.lookup;

import com.storedsafe.client.FetchOutcome;
import com.storedsafe.client.StoredSafeException;

/**
 * Thrown when an object fetch fails for a reason a new token cannot fix: an error
 * status other than 403, or a response without the requested value.
 */
public class FetchFailedException extends StoredSafeException {

    private final FetchOutcome.Kind outcome;

    public FetchFailedException(LookupTerm term, FetchOutcome failure) {
        super(Phase.FETCH, "Failed to retrieve " + term + " from StoredSafe: " + failure.getDetail(),
                failure.getStatusCode(), null);
        this.outcome = failure.getKind();
    }

    /** {@code TRANSIENT_FAILURE} or {@code MALFORMED}. */
    public FetchOutcome.Kind getOutcome() {
        return outcome;
    }
}
