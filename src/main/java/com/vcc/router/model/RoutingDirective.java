package com.vcc.router.model;

import java.util.Arrays;
import java.util.List;

public record RoutingDirective(
        DirectiveKind kind,
        List<WeightedModel> models
) {

    public RoutingDirective {
        models = models != null ? List.copyOf(models) : List.of();
    }

    public static RoutingDirective single(String model) {
        return new RoutingDirective(DirectiveKind.SINGLE, List.of(new WeightedModel(model, 1.0d)));
    }

    public static RoutingDirective ordered(String... models) {
        return new RoutingDirective(DirectiveKind.ORDERED,
                Arrays.stream(models).map(m -> new WeightedModel(m, null)).toList());
    }

    public List<String> modelIds() {
        return models.stream().map(WeightedModel::model).toList();
    }
}
