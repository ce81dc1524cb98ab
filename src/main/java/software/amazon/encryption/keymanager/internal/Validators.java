// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import software.amazon.encryption.keymanager.InvalidKeyException;
import software.amazon.encryption.keymanager.InvalidKeyFormatException;

/**
 * Checks shared by several key managers.
 */
public final class Validators {

    private static final int[] AES_KEY_SIZES_BYTES = {16, 32};

    private Validators() {
    }

    /**
     * Rejects keys written by a newer version of a key manager than the one reading them,
     * so that a downgraded manager never accepts a key format it does not understand.
     *
     * @param candidate the version declared by the key
     * @param maxExpected the version of the key manager
     * @throws InvalidKeyException if candidate is negative or greater than maxExpected
     */
    public static void validateVersion(int candidate, int maxExpected) {
        if (candidate < 0 || candidate > maxExpected) {
            throw new InvalidKeyException(String.format(
                    "Key has version %d; only keys with version in range [0..%d] are supported",
                    candidate, maxExpected));
        }
    }

    /**
     * Same check as {@link #validateVersion(int, int)}, applied to the version a key format asks for.
     *
     * @throws InvalidKeyFormatException if candidate is negative or greater than maxExpected
     */
    public static void validateKeyFormatVersion(int candidate, int maxExpected) {
        if (candidate < 0 || candidate > maxExpected) {
            throw new InvalidKeyFormatException(String.format(
                    "Key format has version %d; only key formats with version in range [0..%d] are supported",
                    candidate, maxExpected));
        }
    }

    public static boolean isValidAesKeySize(int sizeInBytes) {
        for (int size : AES_KEY_SIZES_BYTES) {
            if (size == sizeInBytes) {
                return true;
            }
        }
        return false;
    }

    public static void validateAesKeySize(int sizeInBytes) {
        if (!isValidAesKeySize(sizeInBytes)) {
            throw new InvalidKeyException(invalidAesKeySizeMessage(sizeInBytes));
        }
    }

    public static void validateAesKeyFormatSize(int sizeInBytes) {
        if (!isValidAesKeySize(sizeInBytes)) {
            throw new InvalidKeyFormatException(invalidAesKeySizeMessage(sizeInBytes));
        }
    }

    private static String invalidAesKeySizeMessage(int sizeInBytes) {
        return String.format("Invalid AES key size %d; only 128-bit and 256-bit AES keys are supported", sizeInBytes);
    }
}
