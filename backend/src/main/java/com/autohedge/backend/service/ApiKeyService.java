package com.autohedge.backend.service;

import com.autohedge.backend.model.ApiKey;
import com.autohedge.backend.model.User;
import com.autohedge.backend.repository.ApiKeyRepository;
import com.autohedge.backend.repository.UserRepository;
import com.autohedge.backend.security.UserPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Issues, verifies and revokes API keys. Keys are 256 random bits, so a revoked key is never
 * handed out again; only their SHA-256 digest is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    static final String KEY_PREFIX = "ah_";
    private static final int KEY_BYTES = 32;
    private static final int DISPLAY_PREFIX_LENGTH = 10;

    private final ApiKeyRepository apiKeyRepository;
    private final UserRepository userRepository;
    private final SecureRandom secureRandom = new SecureRandom();

    public record IssuedKey(String key, ApiKey stored) {}

    /** Revokes every active key of the user and issues a fresh one. */
    @Transactional
    public IssuedKey issue(String userId) {
        Instant now = Instant.now();
        apiKeyRepository.findByUserIdAndRevokedFalse(userId).forEach(existing -> {
            existing.setRevoked(true);
            existing.setRevokedAt(now);
        });
        String key = generateKey();
        ApiKey stored = apiKeyRepository.save(ApiKey.builder()
                .keyHash(hash(key))
                .keyPrefix(key.substring(0, DISPLAY_PREFIX_LENGTH))
                .userId(userId)
                .createdAt(now)
                .build());
        log.info("Issued API key {}... for user {}", stored.getKeyPrefix(), userId);
        return new IssuedKey(key, stored);
    }

    @Transactional
    public Optional<UserPrincipal> authenticate(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        Optional<ApiKey> stored = apiKeyRepository.findByKeyHash(hash(key));
        if (stored.isEmpty() || stored.get().isRevoked()) {
            return Optional.empty();
        }
        Optional<User> user = userRepository.findById(stored.get().getUserId()).filter(User::isActive);
        user.ifPresent(u -> u.setLastLogin(Instant.now()));
        return user.map(u -> UserPrincipal.builder()
                .userId(u.getId())
                .username(u.getUsername())
                .apiKeyHash(stored.get().getKeyHash())
                .build());
    }

    private String generateKey() {
        byte[] bytes = new byte[KEY_BYTES];
        secureRandom.nextBytes(bytes);
        return KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static String hash(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
