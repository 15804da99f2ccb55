package com.ryuqq.loadguard.adapter.inmemory.store;

import com.ryuqq.loadguard.core.spi.BucketStore;
import com.ryuqq.loadguard.testkit.contract.AbstractBucketStoreContractTest;

/**
 * Contract Tests for {@link InMemoryBucketStore}.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
class InMemoryBucketStoreContractTest extends AbstractBucketStoreContractTest {

    @Override
    protected BucketStore createStore() {
        return new InMemoryBucketStore();
    }
}
