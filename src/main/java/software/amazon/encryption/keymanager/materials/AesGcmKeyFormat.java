// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.materials;

/**
 * Parameters for generating a new {@link AesGcmKey}.
 */
final public class AesGcmKeyFormat {

    private final int _keySize;
    private final int _version;

    private AesGcmKeyFormat(Builder builder) {
        this._keySize = builder._keySize;
        this._version = builder._version;
    }

    static public Builder builder() {
        return new Builder();
    }

    /**
     * @return the requested key length (in bytes)
     */
    public int keySize() {
        return _keySize;
    }

    public int version() {
        return _version;
    }

    static public class Builder {

        private int _keySize = 0;
        private int _version = 0;

        private Builder() {
        }

        public Builder keySize(int keySize) {
            _keySize = keySize;
            return this;
        }

        public Builder version(int version) {
            _version = version;
            return this;
        }

        public AesGcmKeyFormat build() {
            return new AesGcmKeyFormat(this);
        }
    }
}
