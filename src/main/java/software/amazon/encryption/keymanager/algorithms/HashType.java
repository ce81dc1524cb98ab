// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.algorithms;

/**
 * Hash functions an HMAC key can be bound to.
 */
public enum HashType {
    SHA1("HmacSHA1", 20),
    SHA224("HmacSHA224", 28),
    SHA256("HmacSHA256", 32),
    SHA384("HmacSHA384", 48),
    SHA512("HmacSHA512", 64);

    private final String _macAlgorithm;
    private final int _outputLengthBytes;

    HashType(String macAlgorithm, int outputLengthBytes) {
        this._macAlgorithm = macAlgorithm;
        this._outputLengthBytes = outputLengthBytes;
    }

    /**
     * Returns the JCA name of the HMAC built on this hash (e.g., "HmacSHA256").
     * @return the MAC algorithm name
     */
    public String macAlgorithm() {
        return _macAlgorithm;
    }

    /**
     * Returns the length of the untruncated HMAC output, which bounds the tag size of a key.
     * @return the output length (in bytes)
     */
    public int outputLengthBytes() {
        return _outputLengthBytes;
    }
}
