// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * The distinct ways a {@link KeyManager} operation can fail.
 */
public enum KeyManagerErrorKind {
    /**
     * A primitive was requested that the manager has no factory for.
     */
    UNSUPPORTED_PRIMITIVE(ErrorClassification.INVALID_ARGUMENT),
    /**
     * A key failed validation: version too new, bad key size or another structural violation.
     */
    INVALID_KEY(ErrorClassification.INVALID_ARGUMENT),
    /**
     * A key format describes parameters the manager cannot generate keys for.
     */
    INVALID_KEY_FORMAT(ErrorClassification.INVALID_ARGUMENT),
    /**
     * A factory could not build its primitive from a valid key.
     */
    PRIMITIVE_CREATION(ErrorClassification.INTERNAL),
    /**
     * Two factories were registered for the same primitive. Only raised while a manager is constructed.
     */
    DUPLICATE_REGISTRATION(ErrorClassification.FAILED_PRECONDITION),
    /**
     * The manager does not support the operation, e.g. key generation on a verification-only manager.
     */
    NOT_IMPLEMENTED(ErrorClassification.UNIMPLEMENTED);

    private final ErrorClassification _classification;

    KeyManagerErrorKind(ErrorClassification classification) {
        _classification = classification;
    }

    public ErrorClassification classification() {
        return _classification;
    }
}
