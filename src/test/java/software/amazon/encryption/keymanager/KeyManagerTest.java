// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

import org.junit.jupiter.api.Test;
import software.amazon.encryption.keymanager.internal.AesGcmAead;
import software.amazon.encryption.keymanager.internal.PrimitiveFactory;
import software.amazon.encryption.keymanager.internal.SecureRandomSource;
import software.amazon.encryption.keymanager.internal.Validators;
import software.amazon.encryption.keymanager.materials.AesGcmKey;
import software.amazon.encryption.keymanager.materials.AesGcmKeyFormat;
import software.amazon.encryption.keymanager.primitives.Aead;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class KeyManagerTest {

    /**
     * Gives plain access to the key. Lets the tests check that one manager can serve several primitives.
     */
    static class AeadVariant {
        private final byte[] _keyValue;

        AeadVariant(byte[] keyValue) {
            _keyValue = keyValue;
        }

        byte[] get() {
            return _keyValue;
        }
    }

    static class NotRegistered {
    }

    static class AeadFactory extends PrimitiveFactory<AesGcmKey, Aead> {
        AeadFactory() {
            super(Aead.class);
        }

        @Override
        public Aead create(AesGcmKey key) {
            return new AesGcmAead(key.secretKey(), null, new SecureRandom());
        }
    }

    static class AeadVariantFactory extends PrimitiveFactory<AesGcmKey, AeadVariant> {
        AeadVariantFactory() {
            super(AeadVariant.class);
        }

        @Override
        public AeadVariant create(AesGcmKey key) {
            return new AeadVariant(key.keyValue());
        }
    }

    /**
     * Accepts every key and generates keys of the requested size.
     */
    static class ExampleMultiKeyManager extends KeyManager<AesGcmKey, AesGcmKeyFormat> {

        ExampleMultiKeyManager() {
            super(new AeadFactory(), new AeadVariantFactory());
        }

        @Override
        public void validateKey(AesGcmKey key) {
        }

        @Override
        public void validateKeyFormat(AesGcmKeyFormat keyFormat) {
        }

        @Override
        protected AesGcmKey generateKey(AesGcmKeyFormat keyFormat) {
            return AesGcmKey.builder()
                    .keyValue(new SecureRandomSource().getRandomBytes(keyFormat.keySize()))
                    .build();
        }

        @Override
        public int getVersion() {
            return 0;
        }

        @Override
        public String getKeyType() {
            return "myKeyType";
        }

        @Override
        public KeyMaterialType keyMaterialType() {
            return KeyMaterialType.SYMMETRIC;
        }
    }

    /**
     * Validates keys but cannot generate them.
     */
    static class ExampleMultiKeyManagerWithoutKeyGeneration extends KeyManager<AesGcmKey, Void> {

        @SafeVarargs
        ExampleMultiKeyManagerWithoutKeyGeneration(PrimitiveFactory<AesGcmKey, ?>... factories) {
            super(factories);
        }

        ExampleMultiKeyManagerWithoutKeyGeneration() {
            this(new AeadFactory(), new AeadVariantFactory());
        }

        @Override
        public void validateKey(AesGcmKey key) {
            if (key == null) {
                throw new InvalidKeyException("Key must not be null");
            }
            Validators.validateVersion(key.version(), getVersion());
            Validators.validateAesKeySize(key.keySize());
        }

        @Override
        public int getVersion() {
            return 0;
        }

        @Override
        public String getKeyType() {
            return "bla";
        }

        @Override
        public KeyMaterialType keyMaterialType() {
            return KeyMaterialType.SYMMETRIC;
        }
    }

    private static AesGcmKey newKey() {
        return new ExampleMultiKeyManager().createKey(AesGcmKeyFormat.builder().keySize(16).build());
    }

    @Test
    public void createAead() throws Exception {
        AesGcmKey key = newKey();
        assertEquals(16, key.keySize());

        Aead aead = new ExampleMultiKeyManager().getPrimitive(key, Aead.class);
        byte[] aad = "aad".getBytes(StandardCharsets.UTF_8);
        byte[] ciphertext = aead.encrypt("Hi".getBytes(StandardCharsets.UTF_8), aad);
        byte[] plaintext = aead.decrypt(ciphertext, aad);

        assertEquals("Hi", new String(plaintext, StandardCharsets.UTF_8));
    }

    @Test
    public void createAeadVariant() {
        AesGcmKey key = newKey();
        AeadVariant variant = new ExampleMultiKeyManager().getPrimitive(key, AeadVariant.class);
        assertArrayEquals(key.keyValue(), variant.get());
    }

    @Test
    public void createUnregisteredPrimitiveFails() {
        UnsupportedPrimitiveException exception = assertThrows(UnsupportedPrimitiveException.class,
                () -> new ExampleMultiKeyManager().getPrimitive(AesGcmKey.builder().build(), NotRegistered.class));

        assertEquals(KeyManagerErrorKind.UNSUPPORTED_PRIMITIVE, exception.errorKind());
        assertEquals(ErrorClassification.INVALID_ARGUMENT, exception.classification());
        assertTrue(exception.isInvalidArgument());
        assertSame(NotRegistered.class, exception.primitiveClass());
    }

    @Test
    public void createUnregisteredPrimitiveFailsRegardlessOfKey() {
        KeyManager<AesGcmKey, Void> manager = new ExampleMultiKeyManagerWithoutKeyGeneration();

        assertThrows(UnsupportedPrimitiveException.class, () -> manager.getPrimitive(newKey(), NotRegistered.class));
        assertThrows(UnsupportedPrimitiveException.class,
                () -> manager.getPrimitive(AesGcmKey.builder().build(), NotRegistered.class));
        assertThrows(UnsupportedPrimitiveException.class, () -> manager.getPrimitive(null, NotRegistered.class));
        assertThrows(UnsupportedPrimitiveException.class, () -> manager.getPrimitive(newKey(), null));
    }

    @Test
    public void managerWithoutKeyGenerationCreatesPrimitives() throws Exception {
        KeyManager<AesGcmKey, Void> manager = new ExampleMultiKeyManagerWithoutKeyGeneration();
        AesGcmKey key = newKey();

        Aead aead = manager.getPrimitive(key, Aead.class);
        byte[] aad = "aad".getBytes(StandardCharsets.UTF_8);
        byte[] plaintext = aead.decrypt(aead.encrypt("Hi".getBytes(StandardCharsets.UTF_8), aad), aad);
        assertEquals("Hi", new String(plaintext, StandardCharsets.UTF_8));

        assertArrayEquals(key.keyValue(), manager.getPrimitive(key, AeadVariant.class).get());
    }

    @Test
    public void invalidKeyIsRejectedBeforeFactory() {
        AtomicInteger calls = new AtomicInteger();
        PrimitiveFactory<AesGcmKey, Aead> countingFactory = new PrimitiveFactory<AesGcmKey, Aead>(Aead.class) {
            @Override
            public Aead create(AesGcmKey key) {
                calls.incrementAndGet();
                return new AeadFactory().create(key);
            }
        };
        KeyManager<AesGcmKey, Void> manager = new ExampleMultiKeyManagerWithoutKeyGeneration(countingFactory);

        AesGcmKey tooNew = newKey().toBuilder().version(1).build();
        InvalidKeyException exception = assertThrows(InvalidKeyException.class,
                () -> manager.getPrimitive(tooNew, Aead.class));
        assertEquals(KeyManagerErrorKind.INVALID_KEY, exception.errorKind());
        assertTrue(exception.isInvalidArgument());

        AesGcmKey wrongSize = AesGcmKey.builder().keyValue(new byte[20]).build();
        assertThrows(InvalidKeyException.class, () -> manager.getPrimitive(wrongSize, Aead.class));
        assertThrows(InvalidKeyException.class, () -> manager.getPrimitive(null, Aead.class));

        assertEquals(0, calls.get());

        manager.getPrimitive(newKey(), Aead.class);
        assertEquals(1, calls.get());
    }

    @Test
    public void factoryErrorIsPropagatedUnmodified() {
        PrimitiveCreationException failure = new PrimitiveCreationException("no cipher");
        PrimitiveFactory<AesGcmKey, Aead> failingFactory = new PrimitiveFactory<AesGcmKey, Aead>(Aead.class) {
            @Override
            public Aead create(AesGcmKey key) {
                throw failure;
            }
        };
        KeyManager<AesGcmKey, Void> manager = new ExampleMultiKeyManagerWithoutKeyGeneration(failingFactory);

        PrimitiveCreationException thrown = assertThrows(PrimitiveCreationException.class,
                () -> manager.getPrimitive(newKey(), Aead.class));
        assertSame(failure, thrown);
        assertEquals(ErrorClassification.INTERNAL, thrown.classification());
        assertFalse(thrown.isInvalidArgument());
    }

    @Test
    public void duplicateFactoryFailsAtConstruction() {
        DuplicatePrimitiveFactoryException exception = assertThrows(DuplicatePrimitiveFactoryException.class,
                () -> new ExampleMultiKeyManagerWithoutKeyGeneration(new AeadFactory(), new AeadVariantFactory(),
                        new AeadFactory()));

        assertEquals(KeyManagerErrorKind.DUPLICATE_REGISTRATION, exception.errorKind());
        assertEquals(ErrorClassification.FAILED_PRECONDITION, exception.classification());
        assertSame(Aead.class, exception.primitiveClass());
    }

    @Test
    public void managerWithoutFactoriesFailsAtConstruction() {
        assertThrows(IllegalStateException.class,
                () -> new ExampleMultiKeyManagerWithoutKeyGeneration(new PrimitiveFactory[0]));
    }

    @Test
    public void keyGenerationNotImplemented() {
        KeyManager<AesGcmKey, Void> manager = new ExampleMultiKeyManagerWithoutKeyGeneration();

        KeyManagerException createException = assertThrows(KeyManagerException.class, () -> manager.createKey(null));
        assertEquals(KeyManagerErrorKind.NOT_IMPLEMENTED, createException.errorKind());
        assertEquals(ErrorClassification.UNIMPLEMENTED, createException.classification());

        KeyManagerException validateException = assertThrows(KeyManagerException.class,
                () -> manager.validateKeyFormat(null));
        assertEquals(KeyManagerErrorKind.NOT_IMPLEMENTED, validateException.errorKind());
    }

    @Test
    public void keyDerivationNotImplementedByDefault() {
        KeyManagerException exception = assertThrows(KeyManagerException.class,
                () -> new ExampleMultiKeyManager().deriveKey(AesGcmKeyFormat.builder().keySize(16).build(),
                        new ByteArrayInputStream(new byte[16])));
        assertEquals(KeyManagerErrorKind.NOT_IMPLEMENTED, exception.errorKind());
    }

    @Test
    public void supportedPrimitives() {
        KeyManager<AesGcmKey, AesGcmKeyFormat> manager = new ExampleMultiKeyManager();

        assertEquals(Arrays.asList(Aead.class, AeadVariant.class), manager.supportedPrimitives());
        assertSame(Aead.class, manager.firstSupportedPrimitive());
        assertTrue(manager.doesSupport(Aead.class));
        assertTrue(manager.doesSupport(AeadVariant.class));
        assertFalse(manager.doesSupport(NotRegistered.class));
        assertFalse(manager.doesSupport(null));
        assertThrows(UnsupportedOperationException.class, () -> manager.supportedPrimitives().add(NotRegistered.class));
    }

    @Test
    public void metadata() {
        KeyManager<AesGcmKey, AesGcmKeyFormat> manager = new ExampleMultiKeyManager();
        assertEquals(0, manager.getVersion());
        assertEquals("myKeyType", manager.getKeyType());
        assertEquals(KeyMaterialType.SYMMETRIC, manager.keyMaterialType());
    }

    @Test
    public void concurrentUseOfOneManager() throws Exception {
        KeyManager<AesGcmKey, AesGcmKeyFormat> manager = new ExampleMultiKeyManager();
        byte[] aad = "aad".getBytes(StandardCharsets.UTF_8);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                final byte[] message = ("message " + i).getBytes(StandardCharsets.UTF_8);
                tasks.add(() -> {
                    AesGcmKey key = manager.createKey(AesGcmKeyFormat.builder().keySize(32).build());
                    Aead aead = manager.getPrimitive(key, Aead.class);
                    return Arrays.equals(message, aead.decrypt(aead.encrypt(message, aad), aad));
                });
            }
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                assertTrue(result.get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }
    }
}
