// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.materials;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import software.amazon.encryption.keymanager.algorithms.HashType;

/**
 * An HMAC key bound to one hash function and one tag size.
 */
final public class HmacKey {

    private final int _version;
    private final HashType _hashType;
    private final int _tagSize;
    private final byte[] _keyValue;

    private HmacKey(Builder builder) {
        this._version = builder._version;
        this._hashType = builder._hashType;
        this._tagSize = builder._tagSize;
        this._keyValue = builder._keyValue;
    }

    static public Builder builder() {
        return new Builder();
    }

    public int version() {
        return _version;
    }

    public HashType hashType() {
        return _hashType;
    }

    /**
     * @return the length (in bytes) MAC tags are truncated to
     */
    public int tagSize() {
        return _tagSize;
    }

    public byte[] keyValue() {
        if (_keyValue == null) {
            return null;
        }
        return _keyValue.clone();
    }

    public int keySize() {
        return _keyValue == null ? 0 : _keyValue.length;
    }

    /**
     * Only valid on a key whose hash type is set.
     */
    public SecretKey secretKey() {
        return new SecretKeySpec(_keyValue, _hashType.macAlgorithm());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    static public class Builder {

        private int _version = 0;
        private HashType _hashType = null;
        private int _tagSize = 0;
        private byte[] _keyValue = null;

        private Builder() {
        }

        private Builder(HmacKey key) {
            this._version = key._version;
            this._hashType = key._hashType;
            this._tagSize = key._tagSize;
            this._keyValue = key._keyValue;
        }

        public Builder version(int version) {
            _version = version;
            return this;
        }

        public Builder hashType(HashType hashType) {
            _hashType = hashType;
            return this;
        }

        public Builder tagSize(int tagSize) {
            _tagSize = tagSize;
            return this;
        }

        public Builder keyValue(byte[] keyValue) {
            _keyValue = keyValue == null ? null : keyValue.clone();
            return this;
        }

        public HmacKey build() {
            return new HmacKey(this);
        }
    }
}
