package org.javai.deployguard.secret;

/**
 * A remote secret store such as a key vault.
 */
@FunctionalInterface
public interface SecretStoreClient {

    /**
     * @return the secret value, or null if the store has no such secret
     * @throws Exception if the store could not be reached or refused the request
     */
    String fetch(String name) throws Exception;

    /**
     * Creates or replaces a secret. Stores are read-only unless they override this.
     *
     * @throws UnsupportedOperationException if the store does not accept writes
     * @throws Exception if the store could not be reached or refused the request
     */
    default void store(String name, String value) throws Exception {
        throw new UnsupportedOperationException("Secret store " + getClass().getName() + " is read-only");
    }
}
