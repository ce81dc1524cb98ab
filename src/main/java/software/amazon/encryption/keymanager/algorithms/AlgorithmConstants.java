// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.algorithms;

public final class AlgorithmConstants {

    public static final String AES_KEY_ALGORITHM = "AES";
    public static final String AES_GCM_CIPHER_NAME = "AES/GCM/NoPadding";
    public static final int AES_GCM_IV_LENGTH_BYTES = 12;
    public static final int AES_GCM_TAG_LENGTH_BYTES = 16;
    public static final int AES_GCM_TAG_LENGTH_BITS = AES_GCM_TAG_LENGTH_BYTES * 8;

    public static final int MIN_HMAC_KEY_SIZE_BYTES = 16;
    public static final int MIN_HMAC_TAG_SIZE_BYTES = 10;

    private AlgorithmConstants() {
    }
}
