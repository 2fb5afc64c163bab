package com.previewenv.aws;

import com.previewenv.core.exception.InvalidConfigurationException;

import java.util.List;

/**
 * Account-level resources the adapters create preview resources in.
 */
public record AwsSettings(
    String region,
    String clusterArn,
    String vpcId,
    List<String> subnetIds,
    List<String> securityGroupIds,
    String listenerArn,
    String namespaceId,
    String executionRoleArn,
    String taskRoleArn,
    String logGroupName
) {
    public AwsSettings {
        subnetIds = subnetIds == null ? List.of() : List.copyOf(subnetIds);
        securityGroupIds = securityGroupIds == null ? List.of() : List.copyOf(securityGroupIds);
    }

    /**
     * @throws InvalidConfigurationException naming the first missing setting
     */
    public AwsSettings validate() {
        require("region", region);
        require("cluster-arn", clusterArn);
        require("vpc-id", vpcId);
        require("listener-arn", listenerArn);
        require("namespace-id", namespaceId);
        require("execution-role-arn", executionRoleArn);
        require("log-group-name", logGroupName);
        if (subnetIds.isEmpty()) {
            throw new InvalidConfigurationException("previewenv.aws.subnet-ids must not be empty");
        }
        if (securityGroupIds.isEmpty()) {
            throw new InvalidConfigurationException("previewenv.aws.security-group-ids must not be empty");
        }
        return this;
    }

    private static void require(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("previewenv.aws." + name + " is required");
        }
    }
}
