// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

/**
 * The role the key material handled by a {@link KeyManager} plays.
 */
public enum KeyMaterialType {
    SYMMETRIC,
    ASYMMETRIC_PRIVATE,
    ASYMMETRIC_PUBLIC,
    /**
     * The key material lives in a remote system, e.g. a KMS, and only a reference is held locally.
     */
    REMOTE
}
