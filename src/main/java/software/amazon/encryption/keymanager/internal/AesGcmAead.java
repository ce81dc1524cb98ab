// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import software.amazon.encryption.keymanager.primitives.Aead;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;

import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.AES_GCM_CIPHER_NAME;
import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.AES_GCM_IV_LENGTH_BYTES;
import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.AES_GCM_TAG_LENGTH_BITS;
import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.AES_GCM_TAG_LENGTH_BYTES;

/**
 * AES-GCM with a random 12-byte IV. The ciphertext layout is {@code iv || ciphertext || tag}.
 * <p>
 * A new {@link Cipher} is created per call, so one instance can be used from many threads.
 */
public final class AesGcmAead implements Aead {

    private final SecretKey _key;
    private final Provider _cryptoProvider;
    private final SecureRandom _secureRandom;

    public AesGcmAead(SecretKey key, Provider cryptoProvider, SecureRandom secureRandom) {
        _key = key;
        _cryptoProvider = cryptoProvider;
        _secureRandom = secureRandom;
    }

    @Override
    public byte[] encrypt(byte[] plaintext, byte[] associatedData) throws GeneralSecurityException {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        final byte[] iv = new byte[AES_GCM_IV_LENGTH_BYTES];
        _secureRandom.nextBytes(iv);

        final Cipher cipher = CryptoFactory.createCipher(AES_GCM_CIPHER_NAME, _cryptoProvider);
        cipher.init(Cipher.ENCRYPT_MODE, _key, new GCMParameterSpec(AES_GCM_TAG_LENGTH_BITS, iv));
        if (associatedData != null && associatedData.length > 0) {
            cipher.updateAAD(associatedData);
        }

        final byte[] output = new byte[AES_GCM_IV_LENGTH_BYTES + cipher.getOutputSize(plaintext.length)];
        System.arraycopy(iv, 0, output, 0, AES_GCM_IV_LENGTH_BYTES);
        cipher.doFinal(plaintext, 0, plaintext.length, output, AES_GCM_IV_LENGTH_BYTES);
        return output;
    }

    @Override
    public byte[] decrypt(byte[] ciphertext, byte[] associatedData) throws GeneralSecurityException {
        if (ciphertext == null || ciphertext.length < AES_GCM_IV_LENGTH_BYTES + AES_GCM_TAG_LENGTH_BYTES) {
            throw new AEADBadTagException("Ciphertext is too short");
        }
        final Cipher cipher = CryptoFactory.createCipher(AES_GCM_CIPHER_NAME, _cryptoProvider);
        cipher.init(Cipher.DECRYPT_MODE, _key,
                new GCMParameterSpec(AES_GCM_TAG_LENGTH_BITS, ciphertext, 0, AES_GCM_IV_LENGTH_BYTES));
        if (associatedData != null && associatedData.length > 0) {
            cipher.updateAAD(associatedData);
        }
        return cipher.doFinal(ciphertext, AES_GCM_IV_LENGTH_BYTES, ciphertext.length - AES_GCM_IV_LENGTH_BYTES);
    }
}
