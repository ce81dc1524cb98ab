// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import org.apache.commons.io.IOUtils;
import software.amazon.encryption.keymanager.InvalidKeyFormatException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads key material for key derivation.
 */
public final class PseudoRandomness {

    private PseudoRandomness() {
    }

    /**
     * @param pseudoRandomness the stream to read from; it is not closed
     * @param length the number of bytes needed
     * @return exactly length bytes from the stream
     * @throws InvalidKeyFormatException if the stream ends before length bytes were read
     */
    public static byte[] readBytes(InputStream pseudoRandomness, int length) {
        if (pseudoRandomness == null) {
            throw new IllegalArgumentException("Pseudo-randomness stream must not be null");
        }
        byte[] bytes = new byte[length];
        try {
            IOUtils.readFully(pseudoRandomness, bytes);
        } catch (IOException e) {
            throw new InvalidKeyFormatException("Not enough pseudo-randomness to derive a " + length + " byte key", e);
        }
        return bytes;
    }
}
