package com.ryuqq.provisioner.adapter.runner.facade;

import com.ryuqq.provisioner.application.engine.ProvisioningEngine;
import com.ryuqq.provisioner.application.facade.MachineView;
import com.ryuqq.provisioner.application.facade.ProvisioningFacade;
import com.ryuqq.provisioner.application.facade.RequestAcceptedView;
import com.ryuqq.provisioner.application.facade.RequestStatusView;
import com.ryuqq.provisioner.application.facade.ReturnRequestView;
import com.ryuqq.provisioner.application.facade.TemplateView;
import com.ryuqq.provisioner.core.exception.AggregateNotFoundException;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.Machine;
import com.ryuqq.provisioner.core.model.MachineId;
import com.ryuqq.provisioner.core.model.Request;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.RequestStatus;
import com.ryuqq.provisioner.core.model.Template;
import com.ryuqq.provisioner.core.model.TemplateId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 워크로드 매니저용 {@link ProvisioningFacade} 구현.
 *
 * <p>엔진 결과를 워크로드 매니저가 기대하는 필드 이름과 소문자 상태 값으로 변환합니다.
 * 상태 조회 시 running Request는 한 번 reconcile한 뒤 결과를 보여주며, reconcile이 실패하면
 * 저장된 상태를 그대로 보여줍니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DefaultProvisioningFacade implements ProvisioningFacade {

    private static final Logger log = LoggerFactory.getLogger(DefaultProvisioningFacade.class);

    static final String RETURN_ACCEPTED_MESSAGE = "Delete VM success.";

    private final ProvisioningEngine engine;
    private final long returnGracePeriodSeconds;

    /**
     * @param engine 프로비저닝 엔진
     * @param returnGracePeriodSeconds 반환 요청 목록에 표시할 유예 시간 (초)
     */
    public DefaultProvisioningFacade(ProvisioningEngine engine, long returnGracePeriodSeconds) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (returnGracePeriodSeconds < 0) {
            throw new IllegalArgumentException(
                "returnGracePeriodSeconds cannot be negative (current: " + returnGracePeriodSeconds + ")");
        }
        this.engine = engine;
        this.returnGracePeriodSeconds = returnGracePeriodSeconds;
    }

    @Override
    public List<TemplateView> getAvailableTemplates() {
        List<TemplateView> views = new ArrayList<>();
        for (Template template : engine.listTemplates()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("type", template.backendType().getApiName());
            if (template.imageId() != null) {
                attributes.put("imageId", template.imageId());
            }
            if (template.instanceType() != null) {
                attributes.put("instanceType", template.instanceType());
            }
            attributes.put("priceType", template.priceType().name().toLowerCase(Locale.ROOT));
            views.add(new TemplateView(template.templateId().getValue(), template.maxNumber(), attributes));
        }
        return views;
    }

    @Override
    public RequestAcceptedView requestMachines(String templateId, int count) {
        RequestId requestId = engine.create(TemplateId.of(templateId), count);
        Request request = engine.dispatch(requestId);
        if (request.status() == RequestStatus.FAILED) {
            return new RequestAcceptedView(requestId.getValue(),
                "Request VM failed: " + request.message());
        }
        String apiName = engine.listTemplates().stream()
            .filter(t -> t.templateId().getValue().equals(templateId))
            .map(t -> t.backendType().getApiName())
            .findFirst()
            .orElse("backend");
        return new RequestAcceptedView(requestId.getValue(), "Request VM success from " + apiName + ".");
    }

    @Override
    public List<RequestStatusView> getRequestStatus(List<String> requestIds) {
        if (requestIds == null) {
            throw new IllegalArgumentException("requestIds cannot be null");
        }
        List<RequestStatusView> views = new ArrayList<>(requestIds.size());
        for (String rawId : requestIds) {
            views.add(statusOf(rawId));
        }
        return views;
    }

    private RequestStatusView statusOf(String rawId) {
        RequestId requestId;
        Request request;
        try {
            requestId = RequestId.of(rawId);
            request = engine.getRequest(requestId);
        } catch (IllegalArgumentException | AggregateNotFoundException e) {
            return new RequestStatusView(rawId, RequestStatus.FAILED.getWireValue(),
                "Request not found: " + rawId, List.of());
        }

        if (request.status() == RequestStatus.RUNNING) {
            try {
                request = engine.reconcile(requestId);
            } catch (ProvisioningException e) {
                log.warn("Reconcile on read of {} failed, returning stored state: {}", requestId, e.getMessage());
            }
        }

        List<MachineView> machines = new ArrayList<>();
        for (Machine machine : engine.getMachines(requestId)) {
            machines.add(toView(machine));
        }
        return new RequestStatusView(rawId, request.status().getWireValue(),
            request.message() == null ? "" : request.message(), machines);
    }

    private static MachineView toView(Machine machine) {
        return new MachineView(
            machine.id().getValue(),
            machine.name() == null ? "" : machine.name(),
            machine.result().getWireValue(),
            machine.status().getWireValue(),
            machine.privateIpAddress(),
            machine.publicIpAddress(),
            machine.launchTime() == null ? 0L : machine.launchTime().getEpochSecond(),
            machine.message() == null ? "" : machine.message()
        );
    }

    @Override
    public RequestAcceptedView requestReturnMachines(List<String> machineNames) {
        if (machineNames == null || machineNames.isEmpty()) {
            throw new IllegalArgumentException("machineNames cannot be null or empty");
        }
        List<Machine> known = engine.listMachines();
        List<MachineId> targets = new ArrayList<>();
        for (String name : machineNames) {
            MachineId match = known.stream()
                .filter(m -> m.id().getValue().equals(name) || name.equals(m.name()))
                .map(Machine::id)
                .findFirst()
                .orElseThrow(() -> new AggregateNotFoundException("Machine not found: " + name));
            targets.add(match);
        }
        RequestId returnId = engine.returnMachines(targets);
        Request returned = engine.getRequest(returnId);
        if (returned.status() == RequestStatus.FAILED) {
            return new RequestAcceptedView(returnId.getValue(), "Delete VM failed: " + returned.message());
        }
        return new RequestAcceptedView(returnId.getValue(), RETURN_ACCEPTED_MESSAGE);
    }

    @Override
    public List<ReturnRequestView> getReturnRequests() {
        List<ReturnRequestView> views = new ArrayList<>();
        for (Machine machine : engine.listMachines()) {
            if (machine.returnRequestId() != null && !machine.isTerminal()) {
                String label = machine.name() != null ? machine.name() : machine.id().getValue();
                views.add(new ReturnRequestView(label, returnGracePeriodSeconds));
            }
        }
        return views;
    }
}
