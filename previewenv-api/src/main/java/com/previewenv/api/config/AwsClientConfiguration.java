package com.previewenv.api.config;

import com.previewenv.aws.AwsSettings;
import com.previewenv.aws.CloudMapRegistryBackend;
import com.previewenv.aws.EcsComputeBackend;
import com.previewenv.aws.ElbLoadBalancerBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.servicediscovery.ServiceDiscoveryClient;

/**
 * AWS SDK clients and the backend adapters built on them.
 * Every call is bounded by the configured API call timeout.
 */
@Configuration
public class AwsClientConfiguration {

    @Bean
    public AwsSettings awsSettings(PreviewEnvProperties properties) {
        PreviewEnvProperties.Aws aws = properties.getAws();
        return new AwsSettings(
            aws.getRegion(),
            aws.getClusterArn(),
            aws.getVpcId(),
            aws.getSubnetIds(),
            aws.getSecurityGroupIds(),
            aws.getListenerArn(),
            aws.getNamespaceId(),
            aws.getExecutionRoleArn(),
            aws.getTaskRoleArn(),
            aws.getLogGroupName()
        ).validate();
    }

    @Bean(destroyMethod = "close")
    public EcsClient ecsClient(AwsSettings settings, PreviewEnvProperties properties) {
        return EcsClient.builder()
            .region(Region.of(settings.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(overrides(properties))
            .build();
    }

    @Bean(destroyMethod = "close")
    public ElasticLoadBalancingV2Client elasticLoadBalancingClient(AwsSettings settings, PreviewEnvProperties properties) {
        return ElasticLoadBalancingV2Client.builder()
            .region(Region.of(settings.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(overrides(properties))
            .build();
    }

    @Bean(destroyMethod = "close")
    public ServiceDiscoveryClient serviceDiscoveryClient(AwsSettings settings, PreviewEnvProperties properties) {
        return ServiceDiscoveryClient.builder()
            .region(Region.of(settings.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(overrides(properties))
            .build();
    }

    private static ClientOverrideConfiguration overrides(PreviewEnvProperties properties) {
        return ClientOverrideConfiguration.builder()
            .apiCallTimeout(properties.getAws().getApiCallTimeout())
            .build();
    }

    // ========== Backends ==========

    @Bean
    public EcsComputeBackend ecsComputeBackend(EcsClient ecs, AwsSettings settings) {
        return new EcsComputeBackend(ecs, settings);
    }

    @Bean
    public ElbLoadBalancerBackend elbLoadBalancerBackend(ElasticLoadBalancingV2Client elb, AwsSettings settings) {
        return new ElbLoadBalancerBackend(elb, settings);
    }

    @Bean
    public CloudMapRegistryBackend cloudMapRegistryBackend(ServiceDiscoveryClient discovery, AwsSettings settings) {
        return new CloudMapRegistryBackend(discovery, settings);
    }
}
