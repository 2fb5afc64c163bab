package com.previewenv.api;

import com.previewenv.aws.EcsComputeBackend;
import com.previewenv.core.repository.EnvironmentRepository;
import com.previewenv.engine.controller.EnvironmentController;
import com.previewenv.engine.persistence.InMemoryEnvironmentRepository;
import com.previewenv.sweeper.ReconcilingSweeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "previewenv.routing-domain=arn:aws:elasticloadbalancing:eu-west-1:123456789012:listener/app/preview/abc/443",
    "previewenv.sweeper.enabled=false",
    "previewenv.aws.region=eu-west-1",
    "previewenv.aws.cluster-arn=arn:aws:ecs:eu-west-1:123456789012:cluster/preview",
    "previewenv.aws.vpc-id=vpc-123",
    "previewenv.aws.subnet-ids=subnet-a,subnet-b",
    "previewenv.aws.security-group-ids=sg-1",
    "previewenv.aws.listener-arn=arn:aws:elasticloadbalancing:eu-west-1:123456789012:listener/app/preview/abc/443",
    "previewenv.aws.namespace-id=ns-preview",
    "previewenv.aws.execution-role-arn=arn:aws:iam::123456789012:role/exec",
    "previewenv.aws.log-group-name=/preview/services",
    "previewenv.services[0].service-id=web",
    "previewenv.services[0].repository=acme/shop",
    "previewenv.services[0].image=registry.example.com/web:latest"
})
@ActiveProfiles("memory")
class PreviewEnvApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("Context wires the controller over the in-memory store and AWS backends")
    void contextLoads() {
        assertThat(context.getBean(EnvironmentRepository.class)).isInstanceOf(InMemoryEnvironmentRepository.class);
        assertThat(context.getBean(EnvironmentController.class)).isNotNull();
        assertThat(context.getBean(EcsComputeBackend.class)).isNotNull();
        assertThat(context.getBean(ReconcilingSweeper.class).isRunning()).isFalse();
    }
}
