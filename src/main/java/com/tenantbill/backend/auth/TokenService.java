package com.tenantbill.backend.auth;

import com.tenantbill.backend.models.ApiToken;
import com.tenantbill.backend.models.User;
import com.tenantbill.backend.repositories.ApiTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Issues, resolves and rotates opaque bearer tokens.
 * The plain token is returned exactly once; only its SHA-256 hex digest is persisted.
 */
@Service
@Slf4j
public class TokenService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int TOKEN_LENGTH_BYTES = 32; // 256 bits

    private final ApiTokenRepository apiTokenRepository;
    private final Clock clock;

    public TokenService(ApiTokenRepository apiTokenRepository, Clock clock) {
        this.apiTokenRepository = apiTokenRepository;
        this.clock = clock;
    }

    /**
     * Create and persist a token for the user. Participates in the caller's transaction.
     *
     * @return the plain token
     */
    @Transactional
    public String issueToken(User user) {
        String plainToken = generateToken();
        ApiToken token = ApiToken.builder()
                .user(user)
                .tokenHash(hashToken(plainToken))
                .createdAt(OffsetDateTime.now(clock))
                .build();
        apiTokenRepository.save(token);

        log.debug("Issued token {} for user {}", token.getId(), user.getId());
        return plainToken;
    }

    /**
     * Revoke the presented token and issue a replacement for the same user
     */
    @Transactional
    public String rotateToken(Long tokenId) {
        ApiToken current = apiTokenRepository.findById(tokenId)
                .filter(ApiToken::isActive)
                .orElseThrow(() -> new IllegalStateException("Token " + tokenId + " is not active"));

        current.setRevokedAt(OffsetDateTime.now(clock));
        apiTokenRepository.save(current);

        String replacement = issueToken(current.getUser());
        log.info("Rotated token {} for user {}", tokenId, current.getUser().getId());
        return replacement;
    }

    @Transactional(readOnly = true)
    public Optional<AuthenticatedUser> authenticate(String plainToken) {
        if (plainToken == null || plainToken.isBlank()) {
            return Optional.empty();
        }
        return apiTokenRepository.findActiveByTokenHash(hashToken(plainToken))
                .map(token -> new AuthenticatedUser(
                        token.getUser().getId(),
                        token.getUser().getOrganization().getId(),
                        token.getId(),
                        token.getUser().getEmail()));
    }

    public static String hashToken(String plainToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(plainToken.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String generateToken() {
        byte[] randomBytes = new byte[TOKEN_LENGTH_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }
}
