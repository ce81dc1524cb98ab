// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import software.amazon.encryption.keymanager.KeyManagerException;

/**
 * Turns a key into one specific primitive. A {@link software.amazon.encryption.keymanager.KeyManager}
 * holds one factory per primitive it supports and dispatches on {@link #getPrimitiveClass()}.
 * <p>
 * Keys reach {@link #create(Object)} only after the owning manager validated them. Implementations
 * must not hold on to the key after the call returns, and must be reentrant: a single factory is
 * shared by every thread that uses its manager, so it may not keep mutable state.
 *
 * @param <KeyT> the key type the factory reads
 * @param <PrimitiveT> the primitive interface the factory produces
 */
public abstract class PrimitiveFactory<KeyT, PrimitiveT> {

    private final Class<PrimitiveT> _primitiveClass;

    protected PrimitiveFactory(Class<PrimitiveT> primitiveClass) {
        if (primitiveClass == null) {
            throw new IllegalArgumentException("Primitive class must not be null");
        }
        _primitiveClass = primitiveClass;
    }

    /**
     * @return the primitive interface this factory produces, used as its registry key
     */
    public final Class<PrimitiveT> getPrimitiveClass() {
        return _primitiveClass;
    }

    /**
     * Builds a new primitive instance from the key.
     *
     * @param key a key that already passed validation
     * @return a new primitive, owned by the caller
     * @throws KeyManagerException if the primitive cannot be built; usually a
     *         {@link software.amazon.encryption.keymanager.PrimitiveCreationException}
     */
    public abstract PrimitiveT create(KeyT key);
}
