package com.vcc.router.service.registry;

import com.vcc.router.model.ModelDescriptor;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of registered models.
 */
public interface ModelRegistry {

    Optional<ModelDescriptor> find(String modelId);

    /**
     * Immutable snapshot of every registered model by id, disabled ones included.
     */
    Map<String, ModelDescriptor> snapshot();
}
