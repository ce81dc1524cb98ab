// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager.internal;

import software.amazon.encryption.keymanager.primitives.KeyMaterialAccess;

public final class RawKeyMaterialAccess implements KeyMaterialAccess {

    private final byte[] _keyMaterial;
    private final String _algorithm;

    public RawKeyMaterialAccess(byte[] keyMaterial, String algorithm) {
        _keyMaterial = keyMaterial.clone();
        _algorithm = algorithm;
    }

    @Override
    public byte[] keyMaterial() {
        return _keyMaterial.clone();
    }

    @Override
    public String algorithm() {
        return _algorithm;
    }
}
