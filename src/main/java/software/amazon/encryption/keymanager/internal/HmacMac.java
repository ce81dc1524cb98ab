// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import software.amazon.encryption.keymanager.primitives.Mac;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.Provider;
import java.util.Arrays;

/**
 * HMAC truncated to a fixed tag size.
 */
public final class HmacMac implements Mac {

    private final SecretKey _key;
    private final String _algorithm;
    private final int _tagSize;
    private final Provider _cryptoProvider;

    public HmacMac(SecretKey key, String algorithm, int tagSize, Provider cryptoProvider) {
        _key = key;
        _algorithm = algorithm;
        _tagSize = tagSize;
        _cryptoProvider = cryptoProvider;
    }

    @Override
    public byte[] computeMac(byte[] data) throws GeneralSecurityException {
        // javax.crypto.Mac is stateful, so each call gets its own instance.
        javax.crypto.Mac mac = CryptoFactory.createMac(_algorithm, _cryptoProvider);
        mac.init(_key);
        return Arrays.copyOf(mac.doFinal(data), _tagSize);
    }

    @Override
    public void verifyMac(byte[] mac, byte[] data) throws GeneralSecurityException {
        if (mac == null || mac.length != _tagSize) {
            throw new GeneralSecurityException("Invalid MAC: expected a tag of " + _tagSize + " bytes");
        }
        if (!MessageDigest.isEqual(computeMac(data), mac)) {
            throw new GeneralSecurityException("Invalid MAC");
        }
    }
}
