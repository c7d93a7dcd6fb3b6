package com.esplanada.client.identity;

/**
 * Local persistence for the client's identity.
 * Browser-backed implementations keep it in local storage; tests use {@link InMemoryIdentityStore}.
 */
public interface IdentityStore {

    /**
     * @return the stored identity, or null if none has been saved
     */
    ClientIdentity load();

    void save(ClientIdentity identity);
}
