package com.previewenv.core.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceNamesTest {

    @Test
    void serviceName_joinsEnvironmentAndService() {
        assertThat(ResourceNames.serviceName("pr-42", "web-app")).isEqualTo("pr-42-web-app");
    }

    @Test
    void targetName_keepsShortNamesIntact() {
        assertThat(ResourceNames.targetName("pr-42", "web-app")).isEqualTo("pr-42-web-app");
    }

    @Test
    void targetName_truncatesEachPartAndStaysWithinLimit() {
        String name = ResourceNames.targetName("pr-123456789012345678901234", "orders-service-long");

        assertThat(name).isEqualTo("pr-12345678901234567-orders-ser");
        assertThat(name).hasSizeLessThanOrEqualTo(32);
    }
}
