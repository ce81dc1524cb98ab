// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Thrown when a key format fails {@link KeyManager#validateKeyFormat(Object)}.
 */
public class InvalidKeyFormatException extends KeyManagerException {

    public InvalidKeyFormatException(String message) {
        super(KeyManagerErrorKind.INVALID_KEY_FORMAT, message);
    }

    public InvalidKeyFormatException(String message, Throwable cause) {
        super(KeyManagerErrorKind.INVALID_KEY_FORMAT, message, cause);
    }
}
