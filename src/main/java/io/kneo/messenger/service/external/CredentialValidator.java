package io.kneo.messenger.service.external;

import io.kneo.messenger.model.UserIdentity;
import io.smallrye.mutiny.Uni;

public interface CredentialValidator {

    /**
     * Resolves the bearer credential to a user or fails with an
     * {@link io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType#AUTHENTICATION_FAILURE}.
     */
    Uni<UserIdentity> validate(String token);
}
