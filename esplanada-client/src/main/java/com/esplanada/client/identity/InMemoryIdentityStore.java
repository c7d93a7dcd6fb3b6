package com.esplanada.client.identity;

/**
 * In-memory implementation of IdentityStore for testing and embedded clients.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private volatile ClientIdentity identity;

    @Override
    public ClientIdentity load() {
        return identity;
    }

    @Override
    public void save(ClientIdentity identity) {
        this.identity = identity;
    }
}
