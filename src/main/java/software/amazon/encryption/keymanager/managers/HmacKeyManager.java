// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.managers;

import software.amazon.encryption.keymanager.InvalidKeyException;
import software.amazon.encryption.keymanager.InvalidKeyFormatException;
import software.amazon.encryption.keymanager.KeyManager;
import software.amazon.encryption.keymanager.KeyMaterialType;
import software.amazon.encryption.keymanager.PrimitiveCreationException;
import software.amazon.encryption.keymanager.algorithms.HashType;
import software.amazon.encryption.keymanager.internal.CryptoFactory;
import software.amazon.encryption.keymanager.internal.HmacMac;
import software.amazon.encryption.keymanager.internal.PrimitiveFactory;
import software.amazon.encryption.keymanager.internal.PseudoRandomness;
import software.amazon.encryption.keymanager.internal.RandomnessSource;
import software.amazon.encryption.keymanager.internal.RawKeyMaterialAccess;
import software.amazon.encryption.keymanager.internal.SecureRandomSource;
import software.amazon.encryption.keymanager.internal.Validators;
import software.amazon.encryption.keymanager.materials.HmacKey;
import software.amazon.encryption.keymanager.materials.HmacKeyFormat;
import software.amazon.encryption.keymanager.primitives.KeyMaterialAccess;
import software.amazon.encryption.keymanager.primitives.Mac;

import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.Provider;

import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.MIN_HMAC_KEY_SIZE_BYTES;
import static software.amazon.encryption.keymanager.algorithms.AlgorithmConstants.MIN_HMAC_TAG_SIZE_BYTES;

/**
 * Key manager for HMAC keys. Supports the {@link Mac} and {@link KeyMaterialAccess} primitives.
 */
public class HmacKeyManager extends KeyManager<HmacKey, HmacKeyFormat> {

    public static final String KEY_TYPE = "software.amazon.encryption.keymanager.HmacKey";
    private static final int VERSION = 0;

    private final RandomnessSource _randomnessSource;

    private HmacKeyManager(Builder builder) {
        super(new MacFactory(builder._cryptoProvider), new KeyMaterialAccessFactory());
        _randomnessSource = builder._randomnessSource;
    }

    public HmacKeyManager() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void validateKey(HmacKey key) {
        if (key == null) {
            throw new InvalidKeyException("HMAC key must not be null");
        }
        Validators.validateVersion(key.version(), VERSION);
        if (key.keySize() < MIN_HMAC_KEY_SIZE_BYTES) {
            throw new InvalidKeyException("HMAC key is too short: " + key.keySize()
                    + " bytes, need at least " + MIN_HMAC_KEY_SIZE_BYTES);
        }
        String problem = checkParams(key.hashType(), key.tagSize());
        if (problem != null) {
            throw new InvalidKeyException(problem);
        }
    }

    @Override
    public void validateKeyFormat(HmacKeyFormat keyFormat) {
        if (keyFormat == null) {
            throw new InvalidKeyFormatException("HMAC key format must not be null");
        }
        Validators.validateKeyFormatVersion(keyFormat.version(), VERSION);
        if (keyFormat.keySize() < MIN_HMAC_KEY_SIZE_BYTES) {
            throw new InvalidKeyFormatException("Requested HMAC key size " + keyFormat.keySize()
                    + " is too small, need at least " + MIN_HMAC_KEY_SIZE_BYTES);
        }
        String problem = checkParams(keyFormat.hashType(), keyFormat.tagSize());
        if (problem != null) {
            throw new InvalidKeyFormatException(problem);
        }
    }

    // Returns a description of what is wrong, or null.
    private static String checkParams(HashType hashType, int tagSize) {
        if (hashType == null) {
            return "HMAC hash type must be set";
        }
        if (tagSize < MIN_HMAC_TAG_SIZE_BYTES) {
            return "HMAC tag size " + tagSize + " is too small, need at least " + MIN_HMAC_TAG_SIZE_BYTES;
        }
        if (tagSize > hashType.outputLengthBytes()) {
            return "HMAC tag size " + tagSize + " is too big for " + hashType
                    + ", at most " + hashType.outputLengthBytes();
        }
        return null;
    }

    @Override
    protected HmacKey generateKey(HmacKeyFormat keyFormat) {
        return keyFrom(keyFormat, _randomnessSource.getRandomBytes(keyFormat.keySize()));
    }

    @Override
    public HmacKey deriveKey(HmacKeyFormat keyFormat, InputStream pseudoRandomness) {
        validateKeyFormat(keyFormat);
        return keyFrom(keyFormat, PseudoRandomness.readBytes(pseudoRandomness, keyFormat.keySize()));
    }

    private static HmacKey keyFrom(HmacKeyFormat keyFormat, byte[] keyValue) {
        return HmacKey.builder()
                .version(VERSION)
                .hashType(keyFormat.hashType())
                .tagSize(keyFormat.tagSize())
                .keyValue(keyValue)
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

    static final class MacFactory extends PrimitiveFactory<HmacKey, Mac> {

        private final Provider _cryptoProvider;

        MacFactory(Provider cryptoProvider) {
            super(Mac.class);
            _cryptoProvider = cryptoProvider;
        }

        @Override
        public Mac create(HmacKey key) {
            String algorithm = key.hashType().macAlgorithm();
            try {
                // Surface a missing algorithm or a rejected key now instead of on first use.
                CryptoFactory.createMac(algorithm, _cryptoProvider).init(key.secretKey());
            } catch (GeneralSecurityException e) {
                throw new PrimitiveCreationException("Unable to create " + algorithm + " MAC", e);
            }
            return new HmacMac(key.secretKey(), algorithm, key.tagSize(), _cryptoProvider);
        }
    }

    static final class KeyMaterialAccessFactory extends PrimitiveFactory<HmacKey, KeyMaterialAccess> {

        KeyMaterialAccessFactory() {
            super(KeyMaterialAccess.class);
        }

        @Override
        public KeyMaterialAccess create(HmacKey key) {
            return new RawKeyMaterialAccess(key.keyValue(), key.hashType().macAlgorithm());
        }
    }

    public static class Builder {
        private Provider _cryptoProvider = null;
        private RandomnessSource _randomnessSource = new SecureRandomSource();

        private Builder() {
        }

        /**
         * Sets the security provider used by the {@link Mac} primitives this manager creates.
         * When unset or null, the default JCA provider chain is used.
         */
        public Builder cryptoProvider(Provider cryptoProvider) {
            _cryptoProvider = cryptoProvider;
            return this;
        }

        public Builder randomnessSource(RandomnessSource randomnessSource) {
            if (randomnessSource == null) {
                throw new IllegalArgumentException("RandomnessSource provided to HmacKeyManager cannot be null");
            }
            _randomnessSource = randomnessSource;
            return this;
        }

        public HmacKeyManager build() {
            return new HmacKeyManager(this);
        }
    }
}
