package com.previewenv.aws;

import com.previewenv.core.backend.RegistrySpec;
import com.previewenv.core.backend.ServiceRegistryBackend;
import com.previewenv.core.exception.BackendException;
import com.previewenv.core.exception.PreviewEnvException;
import com.previewenv.core.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.servicediscovery.ServiceDiscoveryClient;
import software.amazon.awssdk.services.servicediscovery.model.*;

/**
 * Cloud Map services in the preview namespace. Registry references are the
 * Cloud Map service ARNs, which ECS takes directly as registry ARNs.
 */
public class CloudMapRegistryBackend implements ServiceRegistryBackend {

    private static final Logger log = LoggerFactory.getLogger(CloudMapRegistryBackend.class);

    static final long DNS_TTL_SECONDS = 60L;

    private final ServiceDiscoveryClient discovery;
    private final AwsSettings settings;

    public CloudMapRegistryBackend(ServiceDiscoveryClient discovery, AwsSettings settings) {
        this.discovery = discovery;
        this.settings = settings;
    }

    @Override
    public String register(RegistrySpec spec) {
        CreateServiceRequest request = CreateServiceRequest.builder()
            .name(spec.name())
            .namespaceId(settings.namespaceId())
            .dnsConfig(DnsConfig.builder()
                .dnsRecords(DnsRecord.builder().type(RecordType.A).ttl(DNS_TTL_SECONDS).build())
                .routingPolicy(RoutingPolicy.MULTIVALUE)
                .build())
            .healthCheckCustomConfig(HealthCheckCustomConfig.builder().failureThreshold(1).build())
            .tags(
                Tag.builder().key(ResourceTags.ENVIRONMENT).value(spec.environmentId()).build(),
                Tag.builder().key(ResourceTags.SERVICE).value(spec.serviceId()).build())
            .build();

        try {
            String arn = discovery.createService(request).service().arn();
            log.info("Registered Cloud Map service {}", arn);
            return arn;
        } catch (SdkException e) {
            throw translate("createCloudMapService", spec.name(), e);
        }
    }

    @Override
    public void deregister(String registryRef) {
        try {
            discovery.deleteService(DeleteServiceRequest.builder().id(serviceId(registryRef)).build());
            log.info("Deleted Cloud Map service {}", registryRef);
        } catch (SdkException e) {
            throw translate("deleteCloudMapService", registryRef, e);
        }
    }

    /**
     * Cloud Map service id from an ARN of the form {@code arn:aws:servicediscovery:<region>:<account>:service/<id>}.
     * A bare id is returned as is.
     */
    static String serviceId(String registryRef) {
        int slash = registryRef.lastIndexOf('/');
        return slash < 0 ? registryRef : registryRef.substring(slash + 1);
    }

    static PreviewEnvException translate(String operation, String ref, SdkException e) {
        if (e instanceof ServiceNotFoundException) {
            return new ResourceNotFoundException("Cloud Map service", ref, e);
        }
        return new BackendException(operation, e.getMessage(), e);
    }
}
