package com.ryuqq.provisioner.core.repository;

import com.ryuqq.provisioner.core.event.MachineEvent;
import com.ryuqq.provisioner.core.event.RequestEvent;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.Request;

import java.util.List;

/**
 * Request, Machine Aggregate 타입 정의.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class AggregateTypes {

    public static final AggregateType<Request, RequestEvent> REQUEST = new AggregateType<>() {

        @Override
        public String name() {
            return "request";
        }

        @Override
        public String idOf(Request aggregate) {
            return aggregate.id().getValue();
        }

        @Override
        public long versionOf(Request aggregate) {
            return aggregate.version();
        }

        @Override
        public Request replay(List<? extends RequestEvent> events) {
            return Request.replay(events);
        }

        @Override
        public Request applyAll(Request aggregate, List<? extends RequestEvent> events) {
            Request current = aggregate;
            for (RequestEvent event : events) {
                current = current.apply(event);
            }
            return current;
        }

        @Override
        public List<RequestEvent> pendingEventsOf(Request aggregate) {
            return aggregate.pendingEvents();
        }

        @Override
        public Request markCommitted(Request aggregate) {
            return aggregate.markCommitted();
        }
    };

    public static final AggregateType<Machine, MachineEvent> MACHINE = new AggregateType<>() {

        @Override
        public String name() {
            return "machine";
        }

        @Override
        public String idOf(Machine aggregate) {
            return aggregate.id().getValue();
        }

        @Override
        public long versionOf(Machine aggregate) {
            return aggregate.version();
        }

        @Override
        public Machine replay(List<? extends MachineEvent> events) {
            return Machine.replay(events);
        }

        @Override
        public Machine applyAll(Machine aggregate, List<? extends MachineEvent> events) {
            Machine current = aggregate;
            for (MachineEvent event : events) {
                current = current.apply(event);
            }
            return current;
        }

        @Override
        public List<MachineEvent> pendingEventsOf(Machine aggregate) {
            return aggregate.pendingEvents();
        }

        @Override
        public Machine markCommitted(Machine aggregate) {
            return aggregate.markCommitted();
        }
    };

    private AggregateTypes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
