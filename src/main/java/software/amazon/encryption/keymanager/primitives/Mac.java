// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.primitives;

import java.security.GeneralSecurityException;

/**
 * Message authentication code.
 */
public interface Mac {

    byte[] computeMac(byte[] data) throws GeneralSecurityException;

    /**
     * @throws GeneralSecurityException if the tag is not valid for the data
     */
    void verifyMac(byte[] mac, byte[] data) throws GeneralSecurityException;
}
