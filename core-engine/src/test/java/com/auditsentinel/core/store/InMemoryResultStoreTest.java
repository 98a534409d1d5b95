package com.auditsentinel.core.store;

/**
 * Unit tests for {@link InMemoryResultStore}.
 */
class InMemoryResultStoreTest extends AbstractResultStoreTest {

    @Override
    protected ResultStore createStore() {
        return new InMemoryResultStore();
    }
}
