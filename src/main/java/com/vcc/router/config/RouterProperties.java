package com.vcc.router.config;

import com.vcc.router.model.ComplianceTag;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "router")
@Validated
public class RouterProperties {

    @Valid
    private List<ProviderConfig> providers = new ArrayList<>();

    @Valid
    private List<ModelConfig> models = new ArrayList<>();

    @Valid
    private List<SubscriptionConfig> subscriptions = new ArrayList<>();

    // Spring resource patterns of policy documents loaded at startup
    private List<String> policyLocations = new ArrayList<>();

    @Valid
    private List<ExperimentConfig> experiments = new ArrayList<>();

    private HealthConfig health = new HealthConfig();
    private RetryConfig retry = new RetryConfig();
    private TimeoutConfig timeouts = new TimeoutConfig();
    private ComplianceConfig compliance = new ComplianceConfig();
    private BudgetConfig budget = new BudgetConfig();
    private LineageConfig lineage = new LineageConfig();
    private StoreConfig store = new StoreConfig();
    @Valid
    private AdminConfig admin = new AdminConfig();
    private DegradeConfig degrade = new DegradeConfig();

    public List<ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderConfig> providers) {
        this.providers = providers;
    }

    public List<ModelConfig> getModels() {
        return models;
    }

    public void setModels(List<ModelConfig> models) {
        this.models = models;
    }

    public List<SubscriptionConfig> getSubscriptions() {
        return subscriptions;
    }

    public void setSubscriptions(List<SubscriptionConfig> subscriptions) {
        this.subscriptions = subscriptions;
    }

    public List<String> getPolicyLocations() {
        return policyLocations;
    }

    public void setPolicyLocations(List<String> policyLocations) {
        this.policyLocations = policyLocations;
    }

    public List<ExperimentConfig> getExperiments() {
        return experiments;
    }

    public void setExperiments(List<ExperimentConfig> experiments) {
        this.experiments = experiments;
    }

    public HealthConfig getHealth() {
        return health;
    }

    public void setHealth(HealthConfig health) {
        this.health = health;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public TimeoutConfig getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(TimeoutConfig timeouts) {
        this.timeouts = timeouts;
    }

    public ComplianceConfig getCompliance() {
        return compliance;
    }

    public void setCompliance(ComplianceConfig compliance) {
        this.compliance = compliance;
    }

    public BudgetConfig getBudget() {
        return budget;
    }

    public void setBudget(BudgetConfig budget) {
        this.budget = budget;
    }

    public LineageConfig getLineage() {
        return lineage;
    }

    public void setLineage(LineageConfig lineage) {
        this.lineage = lineage;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public AdminConfig getAdmin() {
        return admin;
    }

    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    public DegradeConfig getDegrade() {
        return degrade;
    }

    public void setDegrade(DegradeConfig degrade) {
        this.degrade = degrade;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Upstream provider endpoint.
     */
    public static class ProviderConfig {
        @NotBlank
        private String id;

        @NotBlank
        private String baseUrl;

        private String apiKey;

        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Static model registry entry.
     */
    public static class ModelConfig {
        @NotBlank
        private String id;

        @NotBlank
        private String provider;

        @NotBlank
        private String name;

        private String version = "latest";

        private BigDecimal inputPricePer1k = BigDecimal.ZERO;

        private BigDecimal outputPricePer1k = BigDecimal.ZERO;

        private Set<String> capabilities = new HashSet<>();

        private ComplianceTag compliance = ComplianceTag.EXTERNAL;

        private boolean enabled = true;

        public ModelDescriptor toDescriptor() {
            return new ModelDescriptor(id, provider, name, version, inputPricePer1k, outputPricePer1k,
                    capabilities, compliance, enabled);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public BigDecimal getInputPricePer1k() {
            return inputPricePer1k;
        }

        public void setInputPricePer1k(BigDecimal inputPricePer1k) {
            this.inputPricePer1k = inputPricePer1k;
        }

        public BigDecimal getOutputPricePer1k() {
            return outputPricePer1k;
        }

        public void setOutputPricePer1k(BigDecimal outputPricePer1k) {
            this.outputPricePer1k = outputPricePer1k;
        }

        public Set<String> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
        }

        public ComplianceTag getCompliance() {
            return compliance;
        }

        public void setCompliance(ComplianceTag compliance) {
            this.compliance = compliance;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Static subscription seed.
     */
    public static class SubscriptionConfig {
        private SubscriptionScope scope = SubscriptionScope.TENANT;

        @NotBlank
        private String target;

        private Set<String> models = new HashSet<>();

        private boolean enabled = true;

        public Subscription toSubscription() {
            return new Subscription(scope, target, models, enabled);
        }

        public SubscriptionScope getScope() {
            return scope;
        }

        public void setScope(SubscriptionScope scope) {
            this.scope = scope;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public Set<String> getModels() {
            return models;
        }

        public void setModels(Set<String> models) {
            this.models = models;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Traffic experiment definition.
     */
    public static class ExperimentConfig {
        @NotBlank
        private String id;

        // Null matches every tenant of the app
        private String tenantId;

        @NotBlank
        private String appId;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double trafficPercent;

        private VariantMode mode = VariantMode.SUBSTITUTE;

        // model id -> weight
        private Map<String, Double> variant = new LinkedHashMap<>();

        private GuardrailConfig guardrail = new GuardrailConfig();

        private Duration cooldown = Duration.ofMinutes(30);

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getTenantId() {
            return tenantId;
        }

        public void setTenantId(String tenantId) {
            this.tenantId = tenantId;
        }

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public double getTrafficPercent() {
            return trafficPercent;
        }

        public void setTrafficPercent(double trafficPercent) {
            this.trafficPercent = trafficPercent;
        }

        public VariantMode getMode() {
            return mode;
        }

        public void setMode(VariantMode mode) {
            this.mode = mode;
        }

        public Map<String, Double> getVariant() {
            return variant;
        }

        public void setVariant(Map<String, Double> variant) {
            this.variant = variant;
        }

        public GuardrailConfig getGuardrail() {
            return guardrail;
        }

        public void setGuardrail(GuardrailConfig guardrail) {
            this.guardrail = guardrail;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    public enum VariantMode {
        SUBSTITUTE,
        REWEIGHT
    }

    /**
     * Automatic rollback thresholds of an experiment, relative to its control arm.
     */
    public static class GuardrailConfig {
        // 0.25 = treatment p95 may be at most 25% slower than control
        private double maxLatencyRegression = 0.25;

        private double maxSuccessRateDrop = 0.05;

        @Min(1)
        private int minSamples = 20;

        @Min(1)
        private int windowSize = 200;

        public double getMaxLatencyRegression() {
            return maxLatencyRegression;
        }

        public void setMaxLatencyRegression(double maxLatencyRegression) {
            this.maxLatencyRegression = maxLatencyRegression;
        }

        public double getMaxSuccessRateDrop() {
            return maxSuccessRateDrop;
        }

        public void setMaxSuccessRateDrop(double maxSuccessRateDrop) {
            this.maxSuccessRateDrop = maxSuccessRateDrop;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    /**
     * Circuit breaker and health scoring.
     */
    public static class HealthConfig {
        private Duration window = Duration.ofSeconds(60);

        // Failures within the window that open the circuit
        @Min(1)
        private int failureThreshold = 5;

        private Duration latencyP95Threshold = Duration.ofSeconds(20);

        // How long p95 must stay above the threshold before the circuit opens
        private Duration latencySustain = Duration.ofSeconds(30);

        @Min(1)
        private int minLatencySamples = 10;

        private Duration cooldown = Duration.ofSeconds(30);

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getLatencyP95Threshold() {
            return latencyP95Threshold;
        }

        public void setLatencyP95Threshold(Duration latencyP95Threshold) {
            this.latencyP95Threshold = latencyP95Threshold;
        }

        public Duration getLatencySustain() {
            return latencySustain;
        }

        public void setLatencySustain(Duration latencySustain) {
            this.latencySustain = latencySustain;
        }

        public int getMinLatencySamples() {
            return minLatencySamples;
        }

        public void setMinLatencySamples(int minLatencySamples) {
            this.minLatencySamples = minLatencySamples;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    /**
     * Retry of transient provider failures on the same candidate.
     */
    public static class RetryConfig {
        // Total attempts per candidate, including the first
        @Min(1)
        private int maxAttempts = 3;

        private Duration baseBackoff = Duration.ofMillis(200);

        private Duration maxBackoff = Duration.ofSeconds(2);

        private double jitter = 0.5;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseBackoff() {
            return baseBackoff;
        }

        public void setBaseBackoff(Duration baseBackoff) {
            this.baseBackoff = baseBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Bounds on every external call.
     */
    public static class TimeoutConfig {
        private Duration provider = Duration.ofSeconds(30);
        private Duration sanitizer = Duration.ofSeconds(10);
        private Duration contextualDetector = Duration.ofSeconds(2);
        private Duration lineage = Duration.ofSeconds(2);

        public Duration getProvider() {
            return provider;
        }

        public void setProvider(Duration provider) {
            this.provider = provider;
        }

        public Duration getSanitizer() {
            return sanitizer;
        }

        public void setSanitizer(Duration sanitizer) {
            this.sanitizer = sanitizer;
        }

        public Duration getContextualDetector() {
            return contextualDetector;
        }

        public void setContextualDetector(Duration contextualDetector) {
            this.contextualDetector = contextualDetector;
        }

        public Duration getLineage() {
            return lineage;
        }

        public void setLineage(Duration lineage) {
            this.lineage = lineage;
        }
    }

    public static class ComplianceConfig {
        // Requests above this level never reach external models
        private Sensitivity sensitivityThreshold = Sensitivity.MEDIUM;

        public Sensitivity getSensitivityThreshold() {
            return sensitivityThreshold;
        }

        public void setSensitivityThreshold(Sensitivity sensitivityThreshold) {
            this.sensitivityThreshold = sensitivityThreshold;
        }
    }

    /**
     * Spend ledger storage.
     */
    public static class BudgetConfig {
        // memory | redis
        private String store = "memory";

        private String keyPrefix = "router:budget:";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    /**
     * Decision trace persistence.
     */
    public static class LineageConfig {
        // Records kept locally while the sink is unavailable
        @Min(1)
        private int bufferCapacity = 10_000;

        private Duration flushInterval = Duration.ofSeconds(15);

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }
    }

    public static class StoreConfig {
        // Load registry, subscriptions and policies from the database in addition to YAML
        private boolean useDatabase = false;

        public boolean isUseDatabase() {
            return useDatabase;
        }

        public void setUseDatabase(boolean useDatabase) {
            this.useDatabase = useDatabase;
        }
    }

    /**
     * Admin API configuration.
     */
    public static class AdminConfig {
        @NotBlank
        private String apiKeyHeader = "X-Admin-Api-Key";

        private List<String> adminApiKeys = new ArrayList<>();

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        public List<String> getAdminApiKeys() {
            return adminApiKeys;
        }

        public void setAdminApiKeys(List<String> adminApiKeys) {
            this.adminApiKeys = adminApiKeys;
        }
    }

    public static class DegradeConfig {
        // Try the cheapest compliant model once more after the fallback chain is exhausted
        private boolean minimalCompletion = false;

        public boolean isMinimalCompletion() {
            return minimalCompletion;
        }

        public void setMinimalCompletion(boolean minimalCompletion) {
            this.minimalCompletion = minimalCompletion;
        }
    }
}
