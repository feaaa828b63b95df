package io.vodsync.auth;

import io.vodsync.VodSyncException;

import java.net.HttpCookie;
import java.util.Optional;

/**
 * Persists the single jAccount authentication cookie between runs.
 */
public interface CredentialStore {

    /**
     * @return the stored cookie; empty when nothing usable is stored.
     */
    Optional<HttpCookie> load();

    /**
     * Replaces any previously stored cookie.
     */
    void save(HttpCookie cookie) throws VodSyncException;

    /**
     * @return a store that never remembers anything.
     */
    static CredentialStore none() {
        return new CredentialStore() {
            @Override
            public Optional<HttpCookie> load() {
                return Optional.empty();
            }

            @Override
            public void save(HttpCookie cookie) {
                // nothing to persist
            }
        };
    }
}
