package com.previewenv.core.backend;

/**
 * Shared load balancer whose listener rules route preview traffic.
 */
public interface LoadBalancerBackend {

    /**
     * @return reference to the created routing target
     */
    String createTarget(TargetSpec spec);

    /**
     * Create a listener rule at the given priority forwarding matching requests to the target.
     *
     * @return reference to the created rule
     */
    String createRule(RuleMatch match, String targetRef, int priority);

    void deleteRule(String ruleRef);

    void deleteTarget(String targetRef);
}
