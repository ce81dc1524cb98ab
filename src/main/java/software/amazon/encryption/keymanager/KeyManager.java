// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

import org.apache.commons.logging.LogFactory;
import software.amazon.encryption.keymanager.internal.PrimitiveFactory;
import software.amazon.encryption.keymanager.internal.PrimitiveRegistry;

import java.io.InputStream;
import java.util.List;

/**
 * Validates, generates and uses keys of a single key type.
 * <p>
 * One key type can back several primitives: an AES-GCM key can be used as an
 * {@link software.amazon.encryption.keymanager.primitives.Aead} and also expose its raw bytes.
 * Each supported primitive is produced by one {@link PrimitiveFactory}; the factories are passed
 * to the constructor and can never be added or removed afterwards. Callers pick the primitive by
 * its interface:
 * <pre>{@code
 * AesGcmKey key = manager.createKey(AesGcmKeyFormat.builder().keySize(16).build());
 * Aead aead = manager.getPrimitive(key, Aead.class);
 * }</pre>
 * <p>
 * A constructed manager is immutable, so all operations may be called concurrently as long as the
 * registered factories, validators and randomness source are themselves thread-safe.
 *
 * @param <KeyT> the key type this manager handles
 * @param <KeyFormatT> the parameters used to generate new keys
 */
public abstract class KeyManager<KeyT, KeyFormatT> {

    private final PrimitiveRegistry<KeyT> _registry;

    /**
     * @param factories one factory per supported primitive
     * @throws DuplicatePrimitiveFactoryException if two factories produce the same primitive
     */
    @SafeVarargs
    protected KeyManager(PrimitiveFactory<KeyT, ?>... factories) {
        if (factories == null) {
            throw new IllegalArgumentException("Primitive factories must not be null");
        }
        PrimitiveRegistry.Builder<KeyT> registryBuilder = PrimitiveRegistry.builder();
        for (PrimitiveFactory<KeyT, ?> factory : factories) {
            registryBuilder.register(factory);
        }
        _registry = registryBuilder.build();
    }

    /**
     * Creates the requested primitive from the key.
     * <p>
     * The lookup happens before the key is inspected, so asking for an unsupported primitive fails
     * with {@link UnsupportedPrimitiveException} whether or not the key is valid. Errors raised by
     * the factory reach the caller unchanged.
     *
     * @param key the key to use
     * @param primitiveClass the primitive interface to produce
     * @return a new primitive instance backed by the key
     * @throws UnsupportedPrimitiveException if no factory produces primitiveClass
     * @throws InvalidKeyException if the key fails {@link #validateKey(Object)}
     * @throws KeyManagerException if the factory fails
     */
    public final <PrimitiveT> PrimitiveT getPrimitive(KeyT key, Class<PrimitiveT> primitiveClass) {
        PrimitiveFactory<KeyT, PrimitiveT> factory = _registry.lookup(primitiveClass);
        if (factory == null) {
            LogFactory.getLog(getClass())
                    .warn("Requested unsupported primitive " + primitiveClass + " from key manager for " + getKeyType());
            throw new UnsupportedPrimitiveException(getKeyType(), primitiveClass);
        }
        validateKey(key);
        return factory.create(key);
    }

    /**
     * Checks that the key can be used by this manager: its version is not newer than
     * {@link #getVersion()} and its algorithm parameters are supported.
     * Must be free of side effects.
     *
     * @throws InvalidKeyException naming the violated constraint
     */
    public abstract void validateKey(KeyT key);

    /**
     * Checks that new keys can be generated from the format.
     * Managers that do not generate keys keep this default, which always fails.
     *
     * @throws InvalidKeyFormatException naming the violated constraint
     * @throws KeyManagerException of kind {@link KeyManagerErrorKind#NOT_IMPLEMENTED} if the manager cannot generate keys
     */
    public void validateKeyFormat(KeyFormatT keyFormat) {
        throw notImplemented("key generation");
    }

    /**
     * Validates the format and generates a new key from it. The returned key always passes
     * {@link #validateKey(Object)} on this manager.
     *
     * @throws InvalidKeyFormatException if the format is invalid
     * @throws PrimitiveCreationException if the generated key does not pass validation,
     * e.g. because the randomness source returned too few bytes
     */
    public final KeyT createKey(KeyFormatT keyFormat) {
        validateKeyFormat(keyFormat);
        KeyT key = generateKey(keyFormat);
        try {
            validateKey(key);
        } catch (InvalidKeyException e) {
            throw new PrimitiveCreationException("Generated key of type " + getKeyType()
                    + " is invalid, check the configured randomness source", e);
        }
        LogFactory.getLog(getClass()).debug("Generated a new key of type " + getKeyType());
        return key;
    }

    /**
     * Generates a key from a format that already passed {@link #validateKeyFormat(Object)}.
     */
    protected KeyT generateKey(KeyFormatT keyFormat) {
        throw notImplemented("key generation");
    }

    /**
     * Builds a key from the format, taking the key material from the stream instead of
     * a randomness source. Used to derive keys deterministically, e.g. from the output of a KDF.
     *
     * @throws KeyManagerException of kind {@link KeyManagerErrorKind#NOT_IMPLEMENTED} unless the manager overrides it
     */
    public KeyT deriveKey(KeyFormatT keyFormat, InputStream pseudoRandomness) {
        throw notImplemented("key derivation");
    }

    /**
     * @return the newest key version this manager understands
     */
    public abstract int getVersion();

    /**
     * @return the identifier of the keys this manager handles
     */
    public abstract String getKeyType();

    public abstract KeyMaterialType keyMaterialType();

    /**
     * @return the primitives this manager can create, in the order their factories were passed in
     */
    public final List<Class<?>> supportedPrimitives() {
        return _registry.supportedPrimitives();
    }

    public final boolean doesSupport(Class<?> primitiveClass) {
        return _registry.contains(primitiveClass);
    }

    /**
     * @return the primitive of the first factory passed to the constructor
     */
    public final Class<?> firstSupportedPrimitive() {
        return _registry.supportedPrimitives().get(0);
    }

    private KeyManagerException notImplemented(String operation) {
        return new KeyManagerException(KeyManagerErrorKind.NOT_IMPLEMENTED,
                "The key manager for " + getKeyType() + " does not support " + operation);
    }
}
