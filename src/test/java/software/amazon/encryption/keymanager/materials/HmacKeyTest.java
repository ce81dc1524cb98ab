// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.materials;

import org.junit.jupiter.api.Test;
import software.amazon.encryption.keymanager.algorithms.HashType;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class HmacKeyTest {

    @Test
    public void testBuilder() {
        byte[] keyValue = new byte[32];
        HmacKey key = HmacKey.builder()
                .hashType(HashType.SHA384)
                .tagSize(24)
                .keyValue(keyValue)
                .build();
        keyValue[0] = 1;

        assertEquals(HashType.SHA384, key.hashType());
        assertEquals(24, key.tagSize());
        assertArrayEquals(new byte[32], key.keyValue());
        assertEquals("HmacSHA384", key.secretKey().getAlgorithm());
    }

    @Test
    public void testToBuilderKeepsFields() {
        HmacKey key = HmacKey.builder()
                .hashType(HashType.SHA256)
                .tagSize(16)
                .keyValue(new byte[16])
                .build();

        HmacKey copy = key.toBuilder().tagSize(32).build();

        assertEquals(HashType.SHA256, copy.hashType());
        assertEquals(32, copy.tagSize());
        assertEquals(16, copy.keySize());
        assertEquals(16, key.tagSize());
    }
}
