// Copyright Amazon.com Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.encryption.keymanager;

import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Base exception class for all key manager errors.
 * Every instance carries a {@link KeyManagerErrorKind} so that callers can tell a caller
 * programming error (an unsupported primitive, a bad key) apart from an environment problem
 * (a missing cipher) without inspecting the message.
 */
public class KeyManagerException extends SdkClientException {

    private final KeyManagerErrorKind _errorKind;

    private KeyManagerException(BuilderImpl b) {
        super(b);
        if (b._errorKind == null) {
            throw new IllegalArgumentException("Error kind must not be null");
        }
        _errorKind = b._errorKind;
    }

    /**
     * Constructs a new KeyManagerException of the given kind with the specified error message.
     * @param errorKind the kind of failure
     * @param message a description of the error
     */
    public KeyManagerException(KeyManagerErrorKind errorKind, String message) {
        this(errorKind, message, null);
    }

    /**
     * Constructs a new KeyManagerException of the given kind with the specified error message and cause.
     * @param errorKind the kind of failure
     * @param message a description of the error
     * @param cause the underlying cause of this exception
     */
    public KeyManagerException(KeyManagerErrorKind errorKind, String message, Throwable cause) {
        this(new BuilderImpl(errorKind, message, cause));
    }

    /**
     * @return the kind of failure this exception reports
     */
    public KeyManagerErrorKind errorKind() {
        return _errorKind;
    }

    /**
     * @return the classification of {@link #errorKind()}
     */
    public ErrorClassification classification() {
        return _errorKind.classification();
    }

    /**
     * @return true if the failure is caused by the arguments the caller passed in
     */
    public boolean isInvalidArgument() {
        return classification() == ErrorClassification.INVALID_ARGUMENT;
    }

    @Override
    public Builder toBuilder() {
        return new BuilderImpl(this);
    }

    /**
     * Creates a new builder for constructing KeyManagerException instances.
     * An error kind must be set before calling {@link Builder#build()}.
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new BuilderImpl();
    }

    /**
     * Builder interface for constructing KeyManagerException instances.
     */
    public interface Builder extends SdkClientException.Builder {
        Builder errorKind(KeyManagerErrorKind errorKind);

        @Override
        Builder message(String message);

        @Override
        Builder cause(Throwable cause);

        @Override
        KeyManagerException build();
    }

    protected static final class BuilderImpl extends SdkClientException.BuilderImpl implements Builder {

        private KeyManagerErrorKind _errorKind;

        protected BuilderImpl() {
        }

        protected BuilderImpl(KeyManagerException ex) {
            super(ex);
            _errorKind = ex._errorKind;
        }

        private BuilderImpl(KeyManagerErrorKind errorKind, String message, Throwable cause) {
            _errorKind = errorKind;
            this.message = message;
            this.cause = cause;
        }

        @Override
        public Builder errorKind(KeyManagerErrorKind errorKind) {
            _errorKind = errorKind;
            return this;
        }

        @Override
        public Builder message(String message) {
            this.message = message;
            return this;
        }

        @Override
        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        @Override
        public KeyManagerException build() {
            return new KeyManagerException(this);
        }
    }
}
