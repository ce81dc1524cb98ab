// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.NoSuchPaddingException;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;

public class CryptoFactory {

    public static final String PREFER_DEFAULT_SECURITY_PROVIDER_PROPERTY =
            "software.amazon.encryption.keymanager.internal.preferDefaultSecurityProvider";

    public static boolean preferDefaultSecurityProvider() {
        final String preferDefaultSecurityProvider = System.getProperty(PREFER_DEFAULT_SECURITY_PROVIDER_PROPERTY);
        if (preferDefaultSecurityProvider == null) {
            return false;
        }
        return Boolean.parseBoolean(preferDefaultSecurityProvider);
    }

    public static Cipher createCipher(String algorithm, Provider provider)
            throws NoSuchPaddingException, NoSuchAlgorithmException {
        // A global preference for the default Provider chain wins over a configured provider.
        if (provider == null || preferDefaultSecurityProvider()) {
            return Cipher.getInstance(algorithm);
        }
        return Cipher.getInstance(algorithm, provider);
    }

    public static Mac createMac(String algorithm, Provider provider) throws NoSuchAlgorithmException {
        if (provider == null || preferDefaultSecurityProvider()) {
            return Mac.getInstance(algorithm);
        }
        return Mac.getInstance(algorithm, provider);
    }
}
