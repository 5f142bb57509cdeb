package com.sysmuse.leadership.hub;

import java.util.Optional;

/**
 * External directory that maps an organisational email to an account id.
 */
public interface AccountDirectory {

    /**
     * @return the account id, or empty when the directory has no such user
     * @throws AccountLookupException when the directory could not answer
     */
    Optional<String> lookupByEmail(String email) throws AccountLookupException;
}
