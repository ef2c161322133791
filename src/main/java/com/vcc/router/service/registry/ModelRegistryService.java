package com.vcc.router.service.registry;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.entity.ModelDescriptorEntity;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.repository.ModelDescriptorRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Model registry snapshot built from YAML configuration and, optionally, the model_descriptor table.
 * Database rows override YAML entries with the same id. A model whose provider is disabled is
 * reported as disabled.
 */
@Service
public class ModelRegistryService implements ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistryService.class);

    private final RouterProperties properties;
    private final ModelDescriptorRepository repository;
    private final boolean useDatabase;

    private final AtomicReference<Map<String, ModelDescriptor>> modelsRef = new AtomicReference<>(Map.of());

    public ModelRegistryService(RouterProperties properties, ModelDescriptorRepository repository) {
        this.properties = properties;
        this.repository = repository;
        this.useDatabase = properties.getStore().isUseDatabase();
        log.info("ModelRegistryService initialized: useDatabase={}", useDatabase);
    }

    @PostConstruct
    public void init() {
        loadModels()
                .doOnSuccess(count -> log.info("Model registry loaded {} models", count))
                .doOnError(e -> log.error("Failed to load model registry: {}", e.getMessage()))
                .block();
    }

    /**
     * Load models from YAML and the database, then publish the new snapshot.
     *
     * @return number of models in the snapshot
     */
    public Mono<Integer> loadModels() {
        Map<String, ModelDescriptor> loaded = new LinkedHashMap<>();
        for (RouterProperties.ModelConfig model : properties.getModels()) {
            loaded.put(model.getId(), model.toDescriptor());
        }

        Mono<Void> dbLoad = Mono.empty();
        if (useDatabase) {
            dbLoad = repository.findAllOrdered()
                    .map(ModelDescriptorEntity::toDescriptor)
                    .doOnNext(descriptor -> loaded.put(descriptor.id(), descriptor))
                    .then();
        }

        return dbLoad.then(Mono.fromCallable(() -> {
            Set<String> disabledProviders = properties.getProviders().stream()
                    .filter(p -> !p.isEnabled())
                    .map(RouterProperties.ProviderConfig::getId)
                    .collect(Collectors.toSet());

            Map<String, ModelDescriptor> snapshot = new LinkedHashMap<>();
            loaded.forEach((id, descriptor) -> snapshot.put(id,
                    disabledProviders.contains(descriptor.provider()) ? descriptor.withEnabled(false) : descriptor));

            modelsRef.set(Map.copyOf(snapshot));
            snapshot.values().forEach(m -> log.debug("Registered model {} provider={} compliance={} enabled={}",
                    m.id(), m.provider(), m.complianceTag(), m.enabled()));
            return snapshot.size();
        }));
    }

    /**
     * Reload the registry without a restart.
     */
    public Mono<Integer> refresh() {
        log.info("Refreshing model registry...");
        return loadModels()
                .doOnSuccess(count -> log.info("Model registry refreshed: {} models", count));
    }

    @Override
    public Optional<ModelDescriptor> find(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(modelsRef.get().get(modelId));
    }

    @Override
    public Map<String, ModelDescriptor> snapshot() {
        return modelsRef.get();
    }
}
