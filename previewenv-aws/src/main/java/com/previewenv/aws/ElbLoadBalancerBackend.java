package com.previewenv.aws;

import com.previewenv.core.backend.LoadBalancerBackend;
import com.previewenv.core.backend.RuleMatch;
import com.previewenv.core.backend.TargetSpec;
import com.previewenv.core.exception.BackendException;
import com.previewenv.core.exception.PreviewEnvException;
import com.previewenv.core.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Action;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ActionTypeEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateRuleRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.CreateTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteRuleRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DeleteTargetGroupRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.HttpHeaderConditionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.PathPatternConditionConfig;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.ProtocolEnum;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleCondition;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.RuleNotFoundException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Tag;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroupNotFoundException;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetTypeEnum;

import java.util.function.Supplier;

/**
 * IP target groups and listener rules on the shared preview listener.
 * Target references are target group ARNs, rule references are rule ARNs.
 */
public class ElbLoadBalancerBackend implements LoadBalancerBackend {

    private static final Logger log = LoggerFactory.getLogger(ElbLoadBalancerBackend.class);

    static final String HTTP_HEADER = "http-header";
    static final String PATH_PATTERN = "path-pattern";

    private final ElasticLoadBalancingV2Client elb;
    private final AwsSettings settings;

    public ElbLoadBalancerBackend(ElasticLoadBalancingV2Client elb, AwsSettings settings) {
        this.elb = elb;
        this.settings = settings;
    }

    @Override
    public String createTarget(TargetSpec spec) {
        CreateTargetGroupRequest request = CreateTargetGroupRequest.builder()
            .name(spec.name())
            .protocol(ProtocolEnum.HTTP)
            .port(spec.port())
            .vpcId(settings.vpcId())
            .targetType(TargetTypeEnum.IP)
            .healthCheckPath(spec.healthCheckPath())
            .healthCheckProtocol(ProtocolEnum.HTTP)
            .healthCheckIntervalSeconds(spec.healthCheck().intervalSeconds())
            .healthCheckTimeoutSeconds(spec.healthCheck().timeoutSeconds())
            .healthyThresholdCount(spec.healthCheck().healthyThreshold())
            .unhealthyThresholdCount(spec.healthCheck().unhealthyThreshold())
            .tags(
                tag(ResourceTags.ENVIRONMENT, spec.environmentId()),
                tag(ResourceTags.SERVICE, spec.serviceId()))
            .build();

        String arn = call("createTargetGroup", spec.name(),
            () -> elb.createTargetGroup(request).targetGroups().get(0).targetGroupArn());
        log.info("Created target group {}", arn);
        return arn;
    }

    @Override
    public String createRule(RuleMatch match, String targetRef, int priority) {
        CreateRuleRequest request = CreateRuleRequest.builder()
            .listenerArn(settings.listenerArn())
            .priority(priority)
            .conditions(
                RuleCondition.builder()
                    .field(HTTP_HEADER)
                    .httpHeaderConfig(HttpHeaderConditionConfig.builder()
                        .httpHeaderName(match.headerName())
                        .values(match.headerValue())
                        .build())
                    .build(),
                RuleCondition.builder()
                    .field(PATH_PATTERN)
                    .pathPatternConfig(PathPatternConditionConfig.builder()
                        .values(match.pathPattern())
                        .build())
                    .build())
            .actions(Action.builder()
                .type(ActionTypeEnum.FORWARD)
                .targetGroupArn(targetRef)
                .build())
            .tags(tag(ResourceTags.ENVIRONMENT, match.headerValue()))
            .build();

        String arn = call("createRule", match.headerValue() + match.pathPattern(),
            () -> elb.createRule(request).rules().get(0).ruleArn());
        log.info("Created listener rule {} at priority {}", arn, priority);
        return arn;
    }

    @Override
    public void deleteRule(String ruleRef) {
        call("deleteRule", ruleRef,
            () -> elb.deleteRule(DeleteRuleRequest.builder().ruleArn(ruleRef).build()));
        log.info("Deleted listener rule {}", ruleRef);
    }

    @Override
    public void deleteTarget(String targetRef) {
        call("deleteTargetGroup", targetRef,
            () -> elb.deleteTargetGroup(DeleteTargetGroupRequest.builder().targetGroupArn(targetRef).build()));
        log.info("Deleted target group {}", targetRef);
    }

    private static Tag tag(String key, String value) {
        return Tag.builder().key(key).value(value).build();
    }

    private static <T> T call(String operation, String ref, Supplier<T> request) {
        try {
            return request.get();
        } catch (SdkException e) {
            throw translate(operation, ref, e);
        }
    }

    static PreviewEnvException translate(String operation, String ref, SdkException e) {
        if (e instanceof RuleNotFoundException) {
            return new ResourceNotFoundException("Listener rule", ref, e);
        }
        if (e instanceof TargetGroupNotFoundException) {
            return new ResourceNotFoundException("Target group", ref, e);
        }
        return new BackendException(operation, e.getMessage(), e);
    }
}
