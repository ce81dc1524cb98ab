// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * Coarse grouping of {@link KeyManagerErrorKind}s.
 */
public enum ErrorClassification {
    /**
     * The caller passed something the manager cannot accept. Retrying with the same input fails again.
     */
    INVALID_ARGUMENT,
    /**
     * The manager was wired up incorrectly, e.g. two factories for one primitive.
     */
    FAILED_PRECONDITION,
    /**
     * The manager does not implement the requested operation.
     */
    UNIMPLEMENTED,
    /**
     * The underlying cryptographic provider failed.
     */
    INTERNAL
}
