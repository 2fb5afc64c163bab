package com.previewenv.aws;

import java.util.List;

final class AwsFixtures {

    static final String CLUSTER = "arn:aws:ecs:eu-west-1:123456789012:cluster/preview";
    static final String LISTENER = "arn:aws:elasticloadbalancing:eu-west-1:123456789012:listener/app/preview/abc/443";

    private AwsFixtures() {
    }

    static AwsSettings settings() {
        return new AwsSettings("eu-west-1", CLUSTER, "vpc-123", List.of("subnet-a", "subnet-b"),
            List.of("sg-1"), LISTENER, "ns-preview", "arn:aws:iam::123456789012:role/exec",
            "arn:aws:iam::123456789012:role/task", "/preview/services");
    }
}
