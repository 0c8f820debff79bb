package io.certregistry.core.event;

@FunctionalInterface
public interface RegistryEventListener {
    void onEvent(RegistryEvent event);
}
