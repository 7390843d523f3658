package com.resourcelocator.application;

import com.resourcelocator.domain.model.ConnectionDescriptor;

/**
 * Callbacks through which a protocol-specific dispatcher receives a validated
 * connection descriptor. One interface per capability.
 */
public final class ResourceAccess {

    private ResourceAccess() {
    }

    @FunctionalInterface
    public interface Reader<T> {
        T read(ConnectionDescriptor descriptor);
    }

    @FunctionalInterface
    public interface Writer<T> {
        T write(ConnectionDescriptor descriptor);
    }

    @FunctionalInterface
    public interface Deleter<T> {
        T delete(ConnectionDescriptor descriptor);
    }

    @FunctionalInterface
    public interface Searcher<T> {
        T search(ConnectionDescriptor descriptor, String query);
    }
}
