package com.previewenv.engine.controller;

import com.previewenv.core.exception.InvalidConfigurationException;
import com.previewenv.core.model.PriorityRange;

import java.time.Duration;

/**
 * Settings of the lifecycle controller.
 *
 * @param domainName         base domain of preview addresses
 * @param routingDomain      identifier of the shared listener whose priorities are allocated
 * @param priorityRange      priorities reserved for preview environments
 * @param defaultTtl         lifetime given to an environment on CREATE and UPDATE
 * @param maxTtl             upper bound on lifetime measured from creation
 * @param drainWait          pause between scaling a compute service to zero and deleting it
 * @param deregistrationWait pause before deleting a routing target
 */
public record ControllerSettings(
    String domainName,
    String routingDomain,
    PriorityRange priorityRange,
    Duration defaultTtl,
    Duration maxTtl,
    Duration drainWait,
    Duration deregistrationWait
) {
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_MAX_TTL = Duration.ofHours(72);

    public ControllerSettings {
        if (domainName == null || domainName.isBlank()) {
            throw new InvalidConfigurationException("domainName is required");
        }
        if (routingDomain == null || routingDomain.isBlank()) {
            throw new InvalidConfigurationException("routingDomain is required");
        }
        if (priorityRange == null) {
            throw new InvalidConfigurationException("priorityRange is required");
        }
        defaultTtl = defaultTtl == null ? DEFAULT_TTL : defaultTtl;
        maxTtl = maxTtl == null ? DEFAULT_MAX_TTL : maxTtl;
        drainWait = drainWait == null ? Duration.ZERO : drainWait;
        deregistrationWait = deregistrationWait == null ? Duration.ZERO : deregistrationWait;
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new InvalidConfigurationException("defaultTtl must be positive");
        }
        if (maxTtl.compareTo(defaultTtl) < 0) {
            throw new InvalidConfigurationException("maxTtl " + maxTtl + " is shorter than defaultTtl " + defaultTtl);
        }
    }

    public String previewAddressFor(String environmentId) {
        return "https://" + environmentId + "." + domainName;
    }
}
