// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Thrown while a key manager is constructed when two factories produce the same primitive.
 * This is a static misconfiguration; a manager that raised it is never handed out.
 */
public class DuplicatePrimitiveFactoryException extends KeyManagerException {

    private final Class<?> _primitiveClass;

    public DuplicatePrimitiveFactoryException(Class<?> primitiveClass) {
        super(KeyManagerErrorKind.DUPLICATE_REGISTRATION,
                "A primitive factory for " + primitiveClass.getName() + " is already registered");
        _primitiveClass = primitiveClass;
    }

    public Class<?> primitiveClass() {
        return _primitiveClass;
    }
}
