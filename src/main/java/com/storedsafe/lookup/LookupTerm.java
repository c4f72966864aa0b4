package com.storedsafe.lookup;

import java.util.Objects;

/**
 * One requested value: a field of a StoredSafe object.
 *
 * <p>Parsed from {@code "<object_id>/<field_name>"}, split on the first {@code /}
 * only, so the field name may itself contain slashes.
 */
public final class LookupTerm {

    private static final char SEPARATOR = '/';

    private final String objectId;
    private final String fieldName;

    private LookupTerm(String objectId, String fieldName) {
        this.objectId = objectId;
        this.fieldName = fieldName;
    }

    /**
     * Parses a lookup term.
     *
     * @param term the raw term, e.g. {@code "1337/password"}
     * @return the parsed term
     * @throws ConfigurationException if there is no separator or either side is empty
     */
    public static LookupTerm parse(String term) throws ConfigurationException {
        int split = term == null ? -1 : term.indexOf(SEPARATOR);
        if (split <= 0 || split == term.length() - 1) {
            throw new ConfigurationException("Malformed lookup term '" + term
                    + "', expected <objectid>/<fieldname>");
        }
        return new LookupTerm(term.substring(0, split), term.substring(split + 1));
    }

    public String getObjectId() {
        return objectId;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LookupTerm)) {
            return false;
        }
        LookupTerm other = (LookupTerm) o;
        return objectId.equals(other.objectId) && fieldName.equals(other.fieldName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectId, fieldName);
    }

    @Override
    public String toString() {
        return objectId + SEPARATOR + fieldName;
    }
}
