// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.primitives;

import java.security.GeneralSecurityException;

/**
 * Authenticated encryption with associated data (AEAD).
 * <p>
 * The associated data is authenticated but not encrypted; decryption succeeds only when it is
 * passed the same associated data that was used to encrypt.
 */
public interface Aead {

    /**
     * @param plaintext the data to encrypt
     * @param associatedData data to authenticate but not encrypt; null and empty both mean none
     * @return the ciphertext, including everything needed to decrypt it except the key
     */
    byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException;

    /**
     * @param ciphertext a ciphertext produced by {@link #encrypt(byte[], byte[])}
     * @param associatedData the associated data given to encrypt; null and empty are interchangeable
     * @return the plaintext
     * @throws GeneralSecurityException if the ciphertext or associated data fails authentication
     */
    byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException;
}
