package com.previewenv.aws;

import com.previewenv.core.backend.ComputeBackend;
import com.previewenv.core.backend.ComputeServiceSpec;
import com.previewenv.core.backend.TaskTemplateSpec;
import com.previewenv.core.exception.BackendException;
import com.previewenv.core.exception.PreviewEnvException;
import com.previewenv.core.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Fargate task definitions and services on one ECS cluster.
 * Service references are service ARNs.
 */
public class EcsComputeBackend implements ComputeBackend {

    private static final Logger log = LoggerFactory.getLogger(EcsComputeBackend.class);

    static final String NODE_ENV = "development";

    private final EcsClient ecs;
    private final AwsSettings settings;

    public EcsComputeBackend(EcsClient ecs, AwsSettings settings) {
        this.ecs = ecs;
        this.settings = settings;
    }

    @Override
    public String registerTaskTemplate(TaskTemplateSpec spec) {
        String family = spec.family();

        RegisterTaskDefinitionRequest request = RegisterTaskDefinitionRequest.builder()
            .family(family)
            .networkMode(NetworkMode.AWSVPC)
            .requiresCompatibilities(Compatibility.FARGATE)
            .cpu(Integer.toString(spec.cpu()))
            .memory(Integer.toString(spec.memory()))
            .executionRoleArn(settings.executionRoleArn())
            .taskRoleArn(settings.taskRoleArn())
            .containerDefinitions(ContainerDefinition.builder()
                .name(spec.serviceId())
                .image(spec.image())
                .essential(true)
                .portMappings(PortMapping.builder()
                    .containerPort(spec.port())
                    .protocol(TransportProtocol.TCP)
                    .build())
                .environment(containerEnvironment(spec))
                .logConfiguration(LogConfiguration.builder()
                    .logDriver(LogDriver.AWSLOGS)
                    .options(Map.of(
                        "awslogs-group", settings.logGroupName(),
                        "awslogs-region", settings.region(),
                        "awslogs-stream-prefix", family))
                    .build())
                .healthCheck(HealthCheck.builder()
                    .command("CMD-SHELL",
                        "curl -f http://localhost:" + spec.port() + spec.healthCheckPath() + " || exit 1")
                    .interval(30)
                    .timeout(5)
                    .retries(3)
                    .startPeriod(60)
                    .build())
                .build())
            .tags(
                tag(ResourceTags.ENVIRONMENT, spec.environmentId()),
                tag(ResourceTags.SERVICE, spec.serviceId()),
                tag(ResourceTags.COMMIT, spec.commitRef()))
            .build();

        String arn = call("registerTaskDefinition", family,
            () -> ecs.registerTaskDefinition(request).taskDefinition().taskDefinitionArn());
        log.info("Registered task definition {}", arn);
        return arn;
    }

    @Override
    public String createService(ComputeServiceSpec spec) {
        CreateServiceRequest.Builder request = CreateServiceRequest.builder()
            .cluster(settings.clusterArn())
            .serviceName(spec.name())
            .taskDefinition(spec.templateRef())
            .desiredCount(1)
            .launchType(LaunchType.FARGATE)
            .networkConfiguration(NetworkConfiguration.builder()
                .awsvpcConfiguration(AwsVpcConfiguration.builder()
                    .subnets(settings.subnetIds())
                    .securityGroups(settings.securityGroupIds())
                    .assignPublicIp(AssignPublicIp.DISABLED)
                    .build())
                .build())
            .loadBalancers(LoadBalancer.builder()
                .targetGroupArn(spec.targetRef())
                .containerName(spec.serviceId())
                .containerPort(spec.containerPort())
                .build())
            .enableExecuteCommand(true)
            .propagateTags(PropagateTags.SERVICE)
            .tags(
                tag(ResourceTags.ENVIRONMENT, spec.environmentId()),
                tag(ResourceTags.SERVICE, spec.serviceId()));

        // discovery is optional, the service still serves through the load balancer
        if (spec.registryRef() != null) {
            request.serviceRegistries(ServiceRegistry.builder().registryArn(spec.registryRef()).build());
        }

        String arn = call("createService", spec.name(),
            () -> ecs.createService(request.build()).service().serviceArn());
        log.info("Created ECS service {}", arn);
        return arn;
    }

    @Override
    public void forceRedeploy(String serviceRef) {
        call("forceNewDeployment", serviceRef, () -> ecs.updateService(UpdateServiceRequest.builder()
            .cluster(settings.clusterArn())
            .service(serviceRef)
            .forceNewDeployment(true)
            .build()));
        log.info("Forced new deployment of {}", serviceRef);
    }

    @Override
    public void scaleToZero(String serviceRef) {
        call("scaleToZero", serviceRef, () -> ecs.updateService(UpdateServiceRequest.builder()
            .cluster(settings.clusterArn())
            .service(serviceRef)
            .desiredCount(0)
            .build()));
    }

    @Override
    public void deleteService(String serviceRef) {
        call("deleteService", serviceRef, () -> ecs.deleteService(DeleteServiceRequest.builder()
            .cluster(settings.clusterArn())
            .service(serviceRef)
            .force(true)
            .build()));
        log.info("Deleted ECS service {}", serviceRef);
    }

    // ========== Helpers ==========

    static List<KeyValuePair> containerEnvironment(TaskTemplateSpec spec) {
        List<KeyValuePair> variables = new ArrayList<>();
        variables.add(variable("VIRTUAL_ENV_ID", spec.environmentId()));
        variables.add(variable("SERVICE_ID", spec.serviceId()));
        variables.add(variable("NODE_ENV", NODE_ENV));
        spec.environment().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> variables.add(variable(e.getKey(), e.getValue())));
        return variables;
    }

    private static KeyValuePair variable(String name, String value) {
        return KeyValuePair.builder().name(name).value(value).build();
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
        // UpdateService on a deleted service reports it as no longer active
        if (e instanceof ServiceNotFoundException || e instanceof ServiceNotActiveException) {
            return new ResourceNotFoundException("ECS service", ref, e);
        }
        return new BackendException(operation, e.getMessage(), e);
    }
}
