// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Thrown when a key fails {@link KeyManager#validateKey(Object)}.
 * The message names the constraint the key violated.
 */
public class InvalidKeyException extends KeyManagerException {

    public InvalidKeyException(String message) {
        super(KeyManagerErrorKind.INVALID_KEY, message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(KeyManagerErrorKind.INVALID_KEY, message, cause);
    }
}
