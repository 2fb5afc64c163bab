package com.previewenv.engine.test;

import com.previewenv.core.backend.*;
import com.previewenv.core.exception.BackendException;
import com.previewenv.core.exception.ResourceNotFoundException;
import com.previewenv.core.test.FailureInjector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory stand-in for the compute, load balancer and registry backends.
 *
 * Keeps every live resource, records each call in order and consults a
 * {@link FailureInjector} keyed by operation name before doing anything.
 * Deleting a missing resource raises {@link ResourceNotFoundException}, and a
 * rule cannot be created at a priority another rule already holds.
 */
public class FakeCloud implements ComputeBackend, LoadBalancerBackend, ServiceRegistryBackend {

    private final FailureInjector failures;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    private final Map<String, TaskTemplateSpec> templates = new ConcurrentHashMap<>();
    private final Map<String, TargetSpec> targets = new ConcurrentHashMap<>();
    private final Map<String, Integer> rules = new ConcurrentHashMap<>();
    private final Map<String, RegistrySpec> registrations = new ConcurrentHashMap<>();
    private final Map<String, Integer> services = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> redeploys = new ConcurrentHashMap<>();
    private final Map<String, Interleaving> interleavings = new ConcurrentHashMap<>();

    public FakeCloud(FailureInjector failures) {
        this.failures = failures;
    }

    // ========== Compute ==========

    @Override
    public String registerTaskTemplate(TaskTemplateSpec spec) {
        call("registerTaskTemplate", spec.family());
        String ref = "template/" + spec.family() + ":" + sequence.incrementAndGet();
        templates.put(ref, spec);
        return ref;
    }

    @Override
    public String createService(ComputeServiceSpec spec) {
        call("createService", spec.name());
        String ref = "service/" + spec.name() + "/" + sequence.incrementAndGet();
        services.put(ref, 1);
        return ref;
    }

    @Override
    public void forceRedeploy(String serviceRef) {
        call("forceRedeploy", serviceRef);
        requirePresent(services, "ComputeService", serviceRef);
        redeploys.computeIfAbsent(serviceRef, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void scaleToZero(String serviceRef) {
        call("scaleToZero", serviceRef);
        requirePresent(services, "ComputeService", serviceRef);
        services.put(serviceRef, 0);
    }

    @Override
    public void deleteService(String serviceRef) {
        call("deleteService", serviceRef);
        remove(services, "ComputeService", serviceRef);
    }

    // ========== Load Balancer ==========

    @Override
    public String createTarget(TargetSpec spec) {
        call("createTarget", spec.name());
        String ref = "targetgroup/" + spec.name() + "/" + sequence.incrementAndGet();
        targets.put(ref, spec);
        return ref;
    }

    @Override
    public String createRule(RuleMatch match, String targetRef, int priority) {
        call("createRule", match.headerValue() + match.pathPattern());
        if (rules.containsValue(priority)) {
            throw new BackendException("createRule", "PriorityInUse: " + priority);
        }
        String ref = "listener-rule/" + match.headerValue() + "/" + sequence.incrementAndGet();
        rules.put(ref, priority);
        return ref;
    }

    @Override
    public void deleteRule(String ruleRef) {
        call("deleteRule", ruleRef);
        remove(rules, "ListenerRule", ruleRef);
    }

    @Override
    public void deleteTarget(String targetRef) {
        call("deleteTarget", targetRef);
        remove(targets, "TargetGroup", targetRef);
    }

    // ========== Registry ==========

    @Override
    public String register(RegistrySpec spec) {
        call("register", spec.name());
        String ref = "registry/" + spec.name() + "/" + sequence.incrementAndGet();
        registrations.put(ref, spec);
        return ref;
    }

    @Override
    public void deregister(String registryRef) {
        call("deregister", registryRef);
        remove(registrations, "RegistryService", registryRef);
    }

    // ========== Interleaving ==========

    /**
     * Run {@code action} once, inside the next call of {@code operation} whose detail
     * matches, before that call takes effect or consults the failure injector.
     * Used to land a concurrent action in the middle of a deployment.
     */
    public void onceDuring(String operation, Predicate<String> detailMatcher, Runnable action) {
        interleavings.put(operation, new Interleaving(detailMatcher, action));
    }

    // ========== Inspection ==========

    /**
     * Operation names in call order, e.g. "deleteRule".
     */
    public List<String> calls() {
        synchronized (calls) {
            return calls.stream().map(c -> c.substring(0, c.indexOf(' '))).collect(Collectors.toList());
        }
    }

    public List<String> callsFor(String operation) {
        synchronized (calls) {
            return calls.stream()
                .filter(c -> c.startsWith(operation + " "))
                .map(c -> c.substring(operation.length() + 1))
                .collect(Collectors.toList());
        }
    }

    public int count(String operation) {
        return callsFor(operation).size();
    }

    public void clearCalls() {
        calls.clear();
    }

    /**
     * Resources that would still cost money or routing capacity. Task templates are excluded.
     */
    public int liveResources() {
        return targets.size() + rules.size() + registrations.size() + services.size();
    }

    public int liveRules() {
        return rules.size();
    }

    public int liveServices() {
        return services.size();
    }

    public int redeployCount(String serviceRef) {
        AtomicInteger count = redeploys.get(serviceRef);
        return count == null ? 0 : count.get();
    }

    public Integer desiredCount(String serviceRef) {
        return services.get(serviceRef);
    }

    // ========== Internals ==========

    private void call(String operation, String detail) {
        calls.add(operation + " " + detail);
        Interleaving interleaving = interleavings.get(operation);
        if (interleaving != null && interleaving.detailMatcher().test(detail)
                && interleavings.remove(operation, interleaving)) {
            interleaving.action().run();
        }
        failures.check(operation, detail);
    }

    private static void requirePresent(Map<String, ?> resources, String type, String ref) {
        if (!resources.containsKey(ref)) {
            throw new ResourceNotFoundException(type, ref);
        }
    }

    private static void remove(Map<String, ?> resources, String type, String ref) {
        if (resources.remove(ref) == null) {
            throw new ResourceNotFoundException(type, ref);
        }
    }

    private record Interleaving(Predicate<String> detailMatcher, Runnable action) {
    }
}
