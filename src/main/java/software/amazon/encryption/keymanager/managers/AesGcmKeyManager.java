// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.managers;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import software.amazon.encryption.keymanager.InvalidKeyException;
import software.amazon.encryption.keymanager.InvalidKeyFormatException;
import software.amazon.encryption.keymanager.KeyManager;
import software.amazon.encryption.keymanager.KeyMaterialType;
import software.amazon.encryption.keymanager.PrimitiveCreationException;
import software.amazon.encryption.keymanager.algorithms.AlgorithmConstants;
import software.amazon.encryption.keymanager.internal.AesGcmAead;
import software.amazon.encryption.keymanager.internal.CryptoFactory;
import software.amazon.encryption.keymanager.internal.PrimitiveFactory;
import software.amazon.encryption.keymanager.internal.PseudoRandomness;
import software.amazon.encryption.keymanager.internal.RandomnessSource;
import software.amazon.encryption.keymanager.internal.RawKeyMaterialAccess;
import software.amazon.encryption.keymanager.internal.SecureRandomSource;
import software.amazon.encryption.keymanager.internal.Validators;
import software.amazon.encryption.keymanager.materials.AesGcmKey;
import software.amazon.encryption.keymanager.materials.AesGcmKeyFormat;
import software.amazon.encryption.keymanager.primitives.Aead;
import software.amazon.encryption.keymanager.primitives.KeyMaterialAccess;

import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;

/**
 * Key manager for AES-GCM keys of 128 or 256 bits.
 * Supports the {@link Aead} and {@link KeyMaterialAccess} primitives.
 */
public class AesGcmKeyManager extends KeyManager<AesGcmKey, AesGcmKeyFormat> {

    public static final String KEY_TYPE = "software.amazon.encryption.keymanager.AesGcmKey";
    private static final int VERSION = 0;

    private final RandomnessSource _randomnessSource;

    private AesGcmKeyManager(Builder builder) {
        super(new AeadFactory(builder._cryptoProvider, builder._secureRandom),
                new KeyMaterialAccessFactory());
        _randomnessSource = builder._randomnessSource != null
                ? builder._randomnessSource
                : new SecureRandomSource(builder._secureRandom);
    }

    public AesGcmKeyManager() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void validateKey(AesGcmKey key) {
        if (key == null) {
            throw new InvalidKeyException("AES-GCM key must not be null");
        }
        Validators.validateVersion(key.version(), VERSION);
        Validators.validateAesKeySize(key.keySize());
    }

    @Override
    public void validateKeyFormat(AesGcmKeyFormat keyFormat) {
        if (keyFormat == null) {
            throw new InvalidKeyFormatException("AES-GCM key format must not be null");
        }
        Validators.validateKeyFormatVersion(keyFormat.version(), VERSION);
        Validators.validateAesKeyFormatSize(keyFormat.keySize());
    }

    @Override
    protected AesGcmKey generateKey(AesGcmKeyFormat keyFormat) {
        return AesGcmKey.builder()
                .version(VERSION)
                .keyValue(_randomnessSource.getRandomBytes(keyFormat.keySize()))
                .build();
    }

    @Override
    public AesGcmKey deriveKey(AesGcmKeyFormat keyFormat, InputStream pseudoRandomness) {
        validateKeyFormat(keyFormat);
        return AesGcmKey.builder()
                .version(VERSION)
                .keyValue(PseudoRandomness.readBytes(pseudoRandomness, keyFormat.keySize()))
                .build();
    }

    @Override
    public int getVersion() {
        return VERSION;
    }

    @Override
    public String getKeyType() {
        return KEY_TYPE;
    }

    @Override
    public KeyMaterialType keyMaterialType() {
        return KeyMaterialType.SYMMETRIC;
    }

    static final class AeadFactory extends PrimitiveFactory<AesGcmKey, Aead> {

        private final Provider _cryptoProvider;
        private final SecureRandom _secureRandom;

        AeadFactory(Provider cryptoProvider, SecureRandom secureRandom) {
            super(Aead.class);
            _cryptoProvider = cryptoProvider;
            _secureRandom = secureRandom;
        }

        @Override
        public Aead create(AesGcmKey key) {
            try {
                // Fail here rather than on the first encrypt if the provider lacks AES-GCM.
                CryptoFactory.createCipher(AlgorithmConstants.AES_GCM_CIPHER_NAME, _cryptoProvider);
            } catch (GeneralSecurityException e) {
                throw new PrimitiveCreationException("Unable to create " + AlgorithmConstants.AES_GCM_CIPHER_NAME + " cipher", e);
            }
            return new AesGcmAead(key.secretKey(), _cryptoProvider, _secureRandom);
        }
    }

    static final class KeyMaterialAccessFactory extends PrimitiveFactory<AesGcmKey, KeyMaterialAccess> {

        KeyMaterialAccessFactory() {
            super(KeyMaterialAccess.class);
        }

        @Override
        public KeyMaterialAccess create(AesGcmKey key) {
            return new RawKeyMaterialAccess(key.keyValue(), AlgorithmConstants.AES_KEY_ALGORITHM);
        }
    }

    public static class Builder {
        private Provider _cryptoProvider = null;
        private SecureRandom _secureRandom = new SecureRandom();
        private RandomnessSource _randomnessSource = null;

        private Builder() {
        }

        /**
         * Sets the security provider used by the {@link Aead} primitives this manager creates.
         * When unset or null, the default JCA provider chain is used.
         *
         * @param cryptoProvider the provider to use
         * @return a reference to this object so that method calls can be chained together.
         */
        public Builder cryptoProvider(Provider cryptoProvider) {
            _cryptoProvider = cryptoProvider;
            return this;
        }

        /**
         * Sets the SecureRandom used for AES-GCM IVs, and for key generation unless a
         * {@link RandomnessSource} is also set.
         * Note that this does NOT create a defensive copy of the SecureRandom object. Any modifications to the
         * object will be reflected in this Builder.
         */
        @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
        public Builder secureRandom(SecureRandom secureRandom) {
            if (secureRandom == null) {
                throw new IllegalArgumentException("SecureRandom provided to AesGcmKeyManager cannot be null");
            }
            _secureRandom = secureRandom;
            return this;
        }

        /**
         * Sets the source of key material for {@link KeyManager#createKey(Object)}.
         */
        public Builder randomnessSource(RandomnessSource randomnessSource) {
            if (randomnessSource == null) {
                throw new IllegalArgumentException("RandomnessSource provided to AesGcmKeyManager cannot be null");
            }
            _randomnessSource = randomnessSource;
            return this;
        }

        public AesGcmKeyManager build() {
            return new AesGcmKeyManager(this);
        }
    }
}
