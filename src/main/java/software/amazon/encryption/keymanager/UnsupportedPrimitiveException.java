// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Thrown when a {@link KeyManager} is asked for a primitive it has no factory for.
 * This always points at a caller or integration error and is never transient.
 */
public class UnsupportedPrimitiveException extends KeyManagerException {

    private final Class<?> _primitiveClass;

    public UnsupportedPrimitiveException(String keyType, Class<?> primitiveClass) {
        super(KeyManagerErrorKind.UNSUPPORTED_PRIMITIVE,
                "Primitive " + (primitiveClass == null ? "null" : primitiveClass.getName())
                        + " is not supported by the key manager for " + keyType);
        _primitiveClass = primitiveClass;
    }

    /**
     * @return the primitive class that was requested
     */
    public Class<?> primitiveClass() {
        return _primitiveClass;
    }
}
