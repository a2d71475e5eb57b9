package io.kneo.messenger.service.auth;

import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.CredentialValidator;
import io.kneo.messenger.service.external.ParticipantDirectory;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.AUTHENTICATION_FAILURE;
import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.AUTHORIZATION_FAILURE;

@ApplicationScoped
public class AuthGate {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthGate.class);

    private final CredentialValidator credentialValidator;
    private final ParticipantDirectory participantDirectory;

    @Inject
    public AuthGate(CredentialValidator credentialValidator, ParticipantDirectory participantDirectory) {
        this.credentialValidator = credentialValidator;
        this.participantDirectory = participantDirectory;
    }

    public Uni<Admission> admit(String token, long chatId) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new ChatDeliveryException(AUTHENTICATION_FAILURE, "No token provided"));
        }
        return credentialValidator.validate(token)
                .onFailure(failure -> !(failure instanceof ChatDeliveryException))
                .transform(failure -> new ChatDeliveryException(AUTHENTICATION_FAILURE, failure))
                .onItem().transformToUni(user -> participantDirectory.isParticipant(chatId, user.userId())
                        .onItem().transformToUni(member -> {
                            if (!member) {
                                LOGGER.warn("User {} tried to join chat {} without being a participant", user.userId(), chatId);
                                return Uni.createFrom().failure(new ChatDeliveryException(AUTHORIZATION_FAILURE,
                                        "User " + user.userId() + " is not a participant of chat " + chatId));
                            }
                            return Uni.createFrom().item(new Admission(user, chatId));
                        }));
    }
}
