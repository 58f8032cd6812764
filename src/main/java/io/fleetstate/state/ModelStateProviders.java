package io.fleetstate.state;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

public final class ModelStateProviders {
    private ModelStateProviders() {
    }

    public static List<ModelStateProvider> available() {
        List<ModelStateProvider> out = new ArrayList<>();
        for (ModelStateProvider provider : ServiceLoader.load(ModelStateProvider.class)) {
            out.add(provider);
        }
        return out;
    }

    /**
     * @param name provider name; blank picks the only registered provider
     */
    public static ModelStateProvider find(String name) {
        List<ModelStateProvider> providers = available();
        if (name == null || name.isBlank()) {
            if (providers.size() == 1) {
                return providers.get(0);
            }
            throw new IllegalArgumentException(providers.isEmpty()
                    ? "No model state backend registered"
                    : "Several model state backends registered, pick one of " + names(providers));
        }
        for (ModelStateProvider provider : providers) {
            if (provider.name().equalsIgnoreCase(name.trim())) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown model state backend: " + name + ", available: " + names(providers));
    }

    private static List<String> names(List<ModelStateProvider> providers) {
        return providers.stream().map(ModelStateProvider::name).toList();
    }
}
