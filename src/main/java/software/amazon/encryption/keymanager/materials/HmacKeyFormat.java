// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.materials;

import software.amazon.encryption.keymanager.algorithms.HashType;

/**
 * Parameters for generating a new {@link HmacKey}.
 */
final public class HmacKeyFormat {

    private final HashType _hashType;
    private final int _tagSize;
    private final int _keySize;
    private final int _version;

    private HmacKeyFormat(Builder builder) {
        this._hashType = builder._hashType;
        this._tagSize = builder._tagSize;
        this._keySize = builder._keySize;
        this._version = builder._version;
    }

    static public Builder builder() {
        return new Builder();
    }

    public HashType hashType() {
        return _hashType;
    }

    public int tagSize() {
        return _tagSize;
    }

    public int keySize() {
        return _keySize;
    }

    public int version() {
        return _version;
    }

    static public class Builder {

        private HashType _hashType = null;
        private int _tagSize = 0;
        private int _keySize = 0;
        private int _version = 0;

        private Builder() {
        }

        public Builder hashType(HashType hashType) {
            _hashType = hashType;
            return this;
        }

        public Builder tagSize(int tagSize) {
            _tagSize = tagSize;
            return this;
        }

        public Builder keySize(int keySize) {
            _keySize = keySize;
            return this;
        }

        public Builder version(int version) {
            _version = version;
            return this;
        }

        public HmacKeyFormat build() {
            return new HmacKeyFormat(this);
        }
    }
}
