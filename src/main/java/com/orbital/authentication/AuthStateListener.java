package com.orbital.authentication;

/**
 * Receives changes of the {@link ClientAuthCache}. Calls arrive in order on the browser
 * context's event loop thread.
 */
public interface AuthStateListener {

    void onStateChanged(IdentityResolutionState state);

    /**
     * Profile hydration finished for the current subject, or the profile was discarded (null)
     * @param profile Profile or null
     */
    default void onProfileChanged(Profile profile) { }

}
