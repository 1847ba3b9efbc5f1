package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.spi.EventStore;
import com.ryuqq.provisioner.testkit.contract.AbstractEventStoreContractTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventStoreContractTest extends AbstractEventStoreContractTest {

    private InMemoryEventStore<RequestEvent, Request> inMemory;

    @Override
    protected EventStore<RequestEvent, Request> createStore() {
        inMemory = new InMemoryEventStore<>();
        return inMemory;
    }

    @Test
    void clear_모든_스트림을_제거한다() {
        // given
        repository.save(newRequest("req-1"), 0);

        // when
        inMemory.clear();

        // then
        assertThat(store.aggregateIds()).isEmpty();
        assertThat(store.loadEvents("req-1")).isEmpty();
    }
}
