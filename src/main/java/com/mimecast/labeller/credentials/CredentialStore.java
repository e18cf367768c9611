package com.mimecast.labeller.credentials;

import java.util.Optional;

/**
 * Secure storage of mailbox secrets keyed by principal.
 */
public interface CredentialStore {

    /**
     * Looks up the stored secret.
     *
     * @param principal Principal.
     * @return Optional of Secret, empty when none is stored.
     */
    Optional<Secret> get(String principal);

    /**
     * Stores or replaces the secret.
     *
     * @param principal Principal.
     * @param secret    Secret.
     */
    void put(String principal, Secret secret);

    /**
     * Removes the secret if present.
     *
     * @param principal Principal.
     */
    void delete(String principal);
}
