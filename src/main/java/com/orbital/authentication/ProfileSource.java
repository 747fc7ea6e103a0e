package com.orbital.authentication;

import java.io.IOException;

/**
 * Where profiles come from. See {@link RestProfileSource}.
 */
public interface ProfileSource {

    /**
     * Fetches the profile of <code>subjectId</code>
     * @param subjectId Subject identifier
     * @return Profile
     * @throws IOException when the profile can't be fetched
     */
    Profile fetch(String subjectId) throws IOException;

}
