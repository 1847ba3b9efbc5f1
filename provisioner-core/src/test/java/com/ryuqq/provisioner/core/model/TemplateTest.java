package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.exception.ErrorKind;
import com.ryuqq.provisioner.core.exception.TemplateConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateTest {

    @Test
    void build_InlineAndFileProviderSpec_IsConfigurationError() {
        Template.Builder builder = Template.builder("tpl", BackendType.EC2_FLEET)
            .providerSpec(Map.of("Type", "instant"))
            .providerSpecFile("fleet.json");

        TemplateConfigurationException exception = assertThrows(TemplateConfigurationException.class, builder::build);
        assertEquals(ErrorKind.CONFIGURATION, exception.getKind());
    }

    @Test
    void build_InlineAndFileLaunchTemplateSpec_IsConfigurationError() {
        Template.Builder builder = Template.builder("tpl", BackendType.ASG)
            .launchTemplateSpec(Map.of("LaunchTemplateName", "lt"))
            .launchTemplateSpecFile("lt.json");

        assertThrows(TemplateConfigurationException.class, builder::build);
    }

    @Test
    void build_ProviderInlineWithLaunchTemplateFile_IsAllowed() {
        Template template = Template.builder("tpl", BackendType.EC2_FLEET)
            .providerSpec(Map.of("Type", "instant"))
            .launchTemplateSpecFile("lt.json")
            .build();

        assertTrue(template.hasRawSpec());
        assertEquals(MergeMode.MERGE, template.mergeMode());
        assertEquals(PriceType.ONDEMAND, template.priceType());
    }

    @Test
    void build_CopiesRawSpecs_CallerChangesDoNotLeakIn() {
        Map<String, Object> tags = new HashMap<>(Map.of("team", "batch"));
        Map<String, Object> spec = new HashMap<>();
        spec.put("TagSpecifications", tags);
        spec.put("SubnetIds", new ArrayList<>(List.of("subnet-a")));
        spec.put("UserData", null);
        Template template = Template.builder("tpl", BackendType.RUN_INSTANCES)
            .providerSpec(spec)
            .launchTemplateSpec(new HashMap<>(Map.of("LaunchTemplateName", "lt")))
            .build();

        spec.put("InstanceType", "c5.large");
        tags.put("team", "web");

        assertFalse(template.providerSpec().containsKey("InstanceType"));
        assertEquals(Map.of("team", "batch"), template.providerSpec().get("TagSpecifications"));
        assertTrue(template.providerSpec().containsKey("UserData"));
        assertNull(template.providerSpec().get("UserData"));
        assertThrows(UnsupportedOperationException.class,
            () -> template.providerSpec().put("InstanceType", "c5.large"));
        assertThrows(UnsupportedOperationException.class,
            () -> ((List<?>) template.providerSpec().get("SubnetIds")).clear());
        assertThrows(UnsupportedOperationException.class,
            () -> template.launchTemplateSpec().remove("LaunchTemplateName"));
    }

    @Test
    void baseAttributes_UsesBackendKeys() {
        Template template = Template.builder("tpl", BackendType.RUN_INSTANCES)
            .imageId("ami-1")
            .instanceType("t3.medium")
            .subnetIds(List.of("subnet-a", "subnet-b"))
            .securityGroupIds(List.of("sg-1"))
            .build();

        Map<String, Object> attributes = template.baseAttributes();

        assertEquals("ami-1", attributes.get("ImageId"));
        assertEquals("t3.medium", attributes.get("InstanceType"));
        assertEquals(List.of("subnet-a", "subnet-b"), attributes.get("SubnetIds"));
        assertEquals(List.of("sg-1"), attributes.get("SecurityGroupIds"));
        assertFalse(attributes.containsKey("KeyName"));
    }

    @Test
    void requestId_GenerateAndInferType() {
        RequestId provision = RequestId.generate(RequestType.PROVISION, "abc");
        RequestId ret = RequestId.generate(RequestType.RETURN, "abc");

        assertEquals("req-abc", provision.getValue());
        assertEquals(RequestType.PROVISION, provision.inferType());
        assertEquals(RequestType.RETURN, ret.inferType());
    }

    @Test
    void backendType_FromApiName() {
        assertEquals(BackendType.SPOT_FLEET, BackendType.fromName("SpotFleet"));
        assertEquals(BackendType.ASG, BackendType.fromName("asg"));
        assertThrows(IllegalArgumentException.class, () -> BackendType.fromName("Lambda"));
    }
}
