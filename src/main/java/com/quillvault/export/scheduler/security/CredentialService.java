package com.quillvault.export.scheduler.security;

import com.quillvault.export.scheduler.config.AppProperties;
import com.quillvault.export.scheduler.exception.UnauthorizedException;
import com.quillvault.export.scheduler.model.ApiCredential;
import com.quillvault.export.scheduler.repository.ApiCredentialRepository;
import com.quillvault.export.scheduler.service.DatabaseErrorHandlingService;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/** Issues opaque API keys and resolves presented keys to their owner. */
@Service
public class CredentialService {
  private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

  private static final int KEY_BYTES = 32;

  private final ApiCredentialRepository credentialRepository;
  private final DatabaseErrorHandlingService databaseErrors;
  private final Clock clock;
  private final String salt;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialService(
      ApiCredentialRepository credentialRepository,
      DatabaseErrorHandlingService databaseErrors,
      Clock clock,
      AppProperties appProps) {
    this.credentialRepository = credentialRepository;
    this.databaseErrors = databaseErrors;
    this.clock = clock;
    this.salt =
        appProps.security() != null && appProps.security().apiKeySalt() != null
            ? appProps.security().apiKeySalt()
            : "";
    if (salt.isEmpty()) {
      log.warn("app.security.api-key-salt is empty; API key hashes are unsalted");
    }
  }

  public IssuedCredential issue() {
    byte[] raw = new byte[KEY_BYTES];
    secureRandom.nextBytes(raw);
    String apiKey = HexFormat.of().formatHex(raw);

    try {
      ApiCredential credential = credentialRepository.save(new ApiCredential(hash(apiKey)));
      log.info("Issued API credential {}", credential.getId());
      return new IssuedCredential(credential.getId(), apiKey, credential.getCreatedAt());
    } catch (DataAccessException e) {
      throw databaseErrors.translate("issue credential", e);
    }
  }

  /**
   * @throws UnauthorizedException if the key is missing or unknown
   */
  public CallerContext verify(String presentedKey) {
    if (presentedKey == null || presentedKey.isBlank()) {
      throw new UnauthorizedException("API key required");
    }
    try {
      ApiCredential credential =
          credentialRepository
              .findByKeyHash(hash(presentedKey.trim()))
              .orElseThrow(() -> new UnauthorizedException("Invalid API key"));
      LocalDateTime now = LocalDateTime.now(clock);
      credentialRepository.touchLastActive(credential.getId(), now);
      return new CallerContext(credential.getId(), credential.getCreatedAt(), now);
    } catch (DataAccessException e) {
      throw databaseErrors.translate("verify credential", e);
    }
  }

  String hash(String apiKey) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashed = digest.digest((apiKey + salt).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashed);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
