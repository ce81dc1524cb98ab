// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.materials;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import software.amazon.encryption.keymanager.algorithms.AlgorithmConstants;

/**
 * An AES-GCM key: the raw key bytes plus the version of the key format they were written in.
 * Instances are immutable; the key bytes are copied on the way in and on the way out.
 */
final public class AesGcmKey {

    private final int _version;
    private final byte[] _keyValue;

    private AesGcmKey(Builder builder) {
        this._version = builder._version;
        this._keyValue = builder._keyValue;
    }

    static public Builder builder() {
        return new Builder();
    }

    public int version() {
        return _version;
    }

    public byte[] keyValue() {
        if (_keyValue == null) {
            return null;
        }
        return _keyValue.clone();
    }

    /**
     * @return the key length (in bytes), or 0 if no key bytes were set
     */
    public int keySize() {
        return _keyValue == null ? 0 : _keyValue.length;
    }

    public SecretKey secretKey() {
        return new SecretKeySpec(_keyValue, AlgorithmConstants.AES_KEY_ALGORITHM);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    static public class Builder {

        private int _version = 0;
        private byte[] _keyValue = null;

        private Builder() {
        }

        private Builder(AesGcmKey key) {
            this._version = key._version;
            this._keyValue = key._keyValue;
        }

        public Builder version(int version) {
            _version = version;
            return this;
        }

        public Builder keyValue(byte[] keyValue) {
            _keyValue = keyValue == null ? null : keyValue.clone();
            return this;
        }

        public AesGcmKey build() {
            return new AesGcmKey(this);
        }
    }
}
