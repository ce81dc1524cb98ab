// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Thrown by a primitive factory that could not build its primitive from an already validated key,
 * for example because the security provider lacks the required cipher. Also thrown when a newly
 * generated key fails validation.
 */
public class PrimitiveCreationException extends KeyManagerException {

    public PrimitiveCreationException(String message) {
        super(KeyManagerErrorKind.PRIMITIVE_CREATION, message);
    }

    public PrimitiveCreationException(String message, Throwable cause) {
        super(KeyManagerErrorKind.PRIMITIVE_CREATION, message, cause);
    }
}
