package io.kneo.messenger.service.auth;

import io.kneo.messenger.config.MessengerConfig;
import io.kneo.messenger.model.UserIdentity;
import io.kneo.messenger.service.exceptions.ChatDeliveryException;
import io.kneo.messenger.service.external.CredentialValidator;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

import static io.kneo.messenger.service.exceptions.ChatDeliveryException.ErrorType.AUTHENTICATION_FAILURE;

@ApplicationScoped
public class JwtCredentialValidator implements CredentialValidator {
    static final String USER_ID_CLAIM = "uid";

    private final JWTParser jwtParser;
    private final SecretKey secretKey;

    @Inject
    public JwtCredentialValidator(JWTParser jwtParser, MessengerConfig config) {
        this.jwtParser = jwtParser;
        this.secretKey = new SecretKeySpec(config.getJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    @Override
    public Uni<UserIdentity> validate(String token) {
        return Uni.createFrom().item(() -> {
            JsonWebToken jwt;
            try {
                jwt = jwtParser.verify(token, secretKey);
            } catch (ParseException e) {
                throw new ChatDeliveryException(AUTHENTICATION_FAILURE, "Invalid token: " + e.getMessage());
            }
            return new UserIdentity(resolveUserId(jwt), resolveLogin(jwt));
        });
    }

    private long resolveUserId(JsonWebToken jwt) {
        Object claim = jwt.getClaim(USER_ID_CLAIM);
        String raw = claim != null ? claim.toString() : jwt.getSubject();
        if (raw == null || raw.isEmpty()) {
            throw new ChatDeliveryException(AUTHENTICATION_FAILURE, "No user id found in JWT token");
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ChatDeliveryException(AUTHENTICATION_FAILURE, "User id claim is not numeric: " + raw);
        }
    }

    private String resolveLogin(JsonWebToken jwt) {
        String login = jwt.getClaim("preferred_username");
        if (login == null || login.isEmpty()) {
            login = jwt.getName();
        }
        return login;
    }
}
