// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.keymanager.DuplicatePrimitiveFactoryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each primitive interface to the single factory that produces it.
 * Entries are added through {@link Builder} only; the built registry never changes.
 *
 * @param <KeyT> the key type all factories in this registry read
 */
public final class PrimitiveRegistry<KeyT> {

    private final Map<Class<?>, PrimitiveFactory<KeyT, ?>> _factories;
    private final List<Class<?>> _supportedPrimitives;

    private PrimitiveRegistry(Builder<KeyT> builder) {
        _factories = Collections.unmodifiableMap(new LinkedHashMap<>(builder._factories));
        _supportedPrimitives = Collections.unmodifiableList(new ArrayList<>(_factories.keySet()));
    }

    public static <KeyT> Builder<KeyT> builder() {
        return new Builder<>();
    }

    /**
     * @param primitiveClass the requested primitive interface
     * @return the factory registered for it, or null if there is none
     */
    @SuppressWarnings("unchecked")
    public <PrimitiveT> PrimitiveFactory<KeyT, PrimitiveT> lookup(Class<PrimitiveT> primitiveClass) {
        if (primitiveClass == null) {
            return null;
        }
        // Safe: register() keys every entry by the factory's own primitive class.
        return (PrimitiveFactory<KeyT, PrimitiveT>) _factories.get(primitiveClass);
    }

    public boolean contains(Class<?> primitiveClass) {
        return primitiveClass != null && _factories.containsKey(primitiveClass);
    }

    /**
     * @return the registered primitive interfaces, in registration order
     */
    public List<Class<?>> supportedPrimitives() {
        return _supportedPrimitives;
    }

    public int size() {
        return _factories.size();
    }

    public static class Builder<KeyT> {
        private final Map<Class<?>, PrimitiveFactory<KeyT, ?>> _factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @param factory the factory to add
         * @return a reference to this object so that method calls can be chained together.
         * @throws DuplicatePrimitiveFactoryException if a factory for the same primitive is already registered
         */
        public Builder<KeyT> register(PrimitiveFactory<KeyT, ?> factory) {
            if (factory == null) {
                throw new IllegalArgumentException("Primitive factory must not be null");
            }
            Class<?> primitiveClass = factory.getPrimitiveClass();
            if (_factories.containsKey(primitiveClass)) {
                throw new DuplicatePrimitiveFactoryException(primitiveClass);
            }
            _factories.put(primitiveClass, factory);
            return this;
        }

        public PrimitiveRegistry<KeyT> build() {
            if (_factories.isEmpty()) {
                throw new IllegalStateException("At least one primitive factory must be registered");
            }
            PrimitiveRegistry<KeyT> registry = new PrimitiveRegistry<>(this);
            LogFactory.getLog(PrimitiveRegistry.class)
                    .debug("Built primitive registry for " + registry.supportedPrimitives());
            return registry;
        }
    }
}
