// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

/**
 * Supplies the fresh key material consumed by key generation.
 * Implementations are shared across threads and must be safe for concurrent use.
 */
@FunctionalInterface
public interface RandomnessSource {
    byte[] getRandomBytes(int length);
}
