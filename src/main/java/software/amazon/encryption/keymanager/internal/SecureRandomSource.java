// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.security.SecureRandom;

public class SecureRandomSource implements RandomnessSource {

    private final SecureRandom _secureRandom;

    public SecureRandomSource() {
        this(new SecureRandom());
    }

    /**
     * Note that this does NOT create a defensive copy of the SecureRandom object. Any modifications to the
     * object will be reflected in this source.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied SecureRandom is used as-is")
    public SecureRandomSource(SecureRandom secureRandom) {
        if (secureRandom == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        _secureRandom = secureRandom;
    }

    @Override
    public byte[] getRandomBytes(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Cannot generate a negative number of random bytes: " + length);
        }
        byte[] bytes = new byte[length];
        _secureRandom.nextBytes(bytes);
        return bytes;
    }
}
