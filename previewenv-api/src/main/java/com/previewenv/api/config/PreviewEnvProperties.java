package com.previewenv.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration bound from the {@code previewenv} prefix.
 */
@ConfigurationProperties(prefix = "previewenv")
public class PreviewEnvProperties {

    private String domainName;
    private String routingDomain;
    private Priorities priorities = new Priorities();
    private Ttl ttl = new Ttl();
    private Teardown teardown = new Teardown();
    private Sweeper sweeper = new Sweeper();
    private Store store = new Store();
    private Aws aws = new Aws();
    private List<Service> services = new ArrayList<>();

    public String getDomainName() { return domainName; }
    public void setDomainName(String domainName) { this.domainName = domainName; }

    public String getRoutingDomain() { return routingDomain; }
    public void setRoutingDomain(String routingDomain) { this.routingDomain = routingDomain; }

    public Priorities getPriorities() { return priorities; }
    public void setPriorities(Priorities priorities) { this.priorities = priorities; }

    public Ttl getTtl() { return ttl; }
    public void setTtl(Ttl ttl) { this.ttl = ttl; }

    public Teardown getTeardown() { return teardown; }
    public void setTeardown(Teardown teardown) { this.teardown = teardown; }

    public Sweeper getSweeper() { return sweeper; }
    public void setSweeper(Sweeper sweeper) { this.sweeper = sweeper; }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public Aws getAws() { return aws; }
    public void setAws(Aws aws) { this.aws = aws; }

    public List<Service> getServices() { return services; }
    public void setServices(List<Service> services) { this.services = services; }

    // ========== Nested ==========

    public static class Range {
        private int start;
        private int end;

        public Range() {
        }

        public Range(int start, int end) {
            this.start = start;
            this.end = end;
        }

        public int getStart() { return start; }
        public void setStart(int start) { this.start = start; }

        public int getEnd() { return end; }
        public void setEnd(int end) { this.end = end; }
    }

    /**
     * Preview priorities and the ranges other rules on the listener own.
     */
    public static class Priorities {
        private int start = 1;
        private int end = 100;
        private List<Range> reserved = new ArrayList<>(List.of(new Range(101, 900), new Range(901, 1000)));

        public int getStart() { return start; }
        public void setStart(int start) { this.start = start; }

        public int getEnd() { return end; }
        public void setEnd(int end) { this.end = end; }

        public List<Range> getReserved() { return reserved; }
        public void setReserved(List<Range> reserved) { this.reserved = reserved; }
    }

    public static class Ttl {
        private Duration defaultTtl = Duration.ofHours(24);
        private Duration max = Duration.ofHours(72);

        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }

        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
    }

    public static class Teardown {
        private Duration drainWait = Duration.ofSeconds(5);
        private Duration deregistrationWait = Duration.ofSeconds(5);

        public Duration getDrainWait() { return drainWait; }
        public void setDrainWait(Duration drainWait) { this.drainWait = drainWait; }

        public Duration getDeregistrationWait() { return deregistrationWait; }
        public void setDeregistrationWait(Duration deregistrationWait) { this.deregistrationWait = deregistrationWait; }
    }

    public static class Sweeper {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        private Duration gracePeriod = Duration.ofMinutes(30);
        private int batchSize = 100;
        private Duration retention = Duration.ofDays(7);
        private Duration purgeInterval = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }

        public Duration getPurgeInterval() { return purgeInterval; }
        public void setPurgeInterval(Duration purgeInterval) { this.purgeInterval = purgeInterval; }
    }

    /**
     * Repository implementations are selected on {@code previewenv.store.mode}.
     */
    public static class Store {
        private String mode = "jdbc";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }

    public static class Aws {
        private String region;
        private String clusterArn;
        private String vpcId;
        private List<String> subnetIds = new ArrayList<>();
        private List<String> securityGroupIds = new ArrayList<>();
        private String listenerArn;
        private String namespaceId;
        private String executionRoleArn;
        private String taskRoleArn;
        private String logGroupName;
        private Duration apiCallTimeout = Duration.ofSeconds(30);

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getClusterArn() { return clusterArn; }
        public void setClusterArn(String clusterArn) { this.clusterArn = clusterArn; }

        public String getVpcId() { return vpcId; }
        public void setVpcId(String vpcId) { this.vpcId = vpcId; }

        public List<String> getSubnetIds() { return subnetIds; }
        public void setSubnetIds(List<String> subnetIds) { this.subnetIds = subnetIds; }

        public List<String> getSecurityGroupIds() { return securityGroupIds; }
        public void setSecurityGroupIds(List<String> securityGroupIds) { this.securityGroupIds = securityGroupIds; }

        public String getListenerArn() { return listenerArn; }
        public void setListenerArn(String listenerArn) { this.listenerArn = listenerArn; }

        public String getNamespaceId() { return namespaceId; }
        public void setNamespaceId(String namespaceId) { this.namespaceId = namespaceId; }

        public String getExecutionRoleArn() { return executionRoleArn; }
        public void setExecutionRoleArn(String executionRoleArn) { this.executionRoleArn = executionRoleArn; }

        public String getTaskRoleArn() { return taskRoleArn; }
        public void setTaskRoleArn(String taskRoleArn) { this.taskRoleArn = taskRoleArn; }

        public String getLogGroupName() { return logGroupName; }
        public void setLogGroupName(String logGroupName) { this.logGroupName = logGroupName; }

        public Duration getApiCallTimeout() { return apiCallTimeout; }
        public void setApiCallTimeout(Duration apiCallTimeout) { this.apiCallTimeout = apiCallTimeout; }
    }

    /**
     * One previewable service catalog entry.
     */
    public static class Service {
        private String serviceId;
        private String repository;
        private String pathPattern = "/*";
        private int port = 8080;
        private String healthCheckPath = "/health";
        private int cpu = 256;
        private int memory = 512;
        private String image;
        private Map<String, String> environment = new LinkedHashMap<>();
        private boolean enabled = true;

        public String getServiceId() { return serviceId; }
        public void setServiceId(String serviceId) { this.serviceId = serviceId; }

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }

        public String getPathPattern() { return pathPattern; }
        public void setPathPattern(String pathPattern) { this.pathPattern = pathPattern; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHealthCheckPath() { return healthCheckPath; }
        public void setHealthCheckPath(String healthCheckPath) { this.healthCheckPath = healthCheckPath; }

        public int getCpu() { return cpu; }
        public void setCpu(int cpu) { this.cpu = cpu; }

        public int getMemory() { return memory; }
        public void setMemory(int memory) { this.memory = memory; }

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }

        public Map<String, String> getEnvironment() { return environment; }
        public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
