// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.primitives;

/**
 * Direct access to the raw bytes of a key.
 * Offers no protection at all; it exists for callers that hand the key to another system,
 * e.g. to wrap it under a KMS key.
 */
public interface KeyMaterialAccess {

    /**
     * @return a copy of the key bytes
     */
    byte[] keyMaterial();

    /**
     * @return the JCA algorithm name the key bytes are meant for, e.g. "AES"
     */
    String algorithm();
}
