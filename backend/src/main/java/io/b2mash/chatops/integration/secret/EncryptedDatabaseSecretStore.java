package io.b2mash.chatops.integration.secret;

import io.b2mash.chatops.exception.ResourceNotFoundException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps workspace tokens AES-256-GCM encrypted in {@code integration_secrets}. The secret key is
 * bound to each ciphertext as associated data, so a row copied under another key fails to decrypt.
 */
@Component
public class EncryptedDatabaseSecretStore implements SecretStore {

  private static final Logger log = LoggerFactory.getLogger(EncryptedDatabaseSecretStore.class);

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int TAG_BITS = 128;
  private static final int IV_BYTES = 12;
  private static final int KEY_BYTES = 32;

  private final IntegrationSecretRepository repository;
  private final SecretKeySpec masterKey;
  private final SecureRandom random = new SecureRandom();

  public EncryptedDatabaseSecretStore(
      IntegrationSecretRepository repository,
      @Value("${integration.encryption-key:}") String base64Key) {
    this.repository = repository;
    this.masterKey = new SecretKeySpec(decodeMasterKey(base64Key), "AES");
  }

  @Override
  @Transactional
  public void store(String secretKey, String plaintext) {
    var iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    var ciphertext =
        encode(
            apply(
                Cipher.ENCRYPT_MODE, secretKey, iv, plaintext.getBytes(StandardCharsets.UTF_8)));

    repository
        .findBySecretKey(secretKey)
        .ifPresentOrElse(
            secret -> secret.updateEncryptedValue(ciphertext, encode(iv)),
            () -> repository.save(new IntegrationSecret(secretKey, ciphertext, encode(iv))));
    log.debug("Stored integration secret: key={}", secretKey);
  }

  @Override
  @Transactional(readOnly = true)
  public String retrieve(String secretKey) {
    var secret =
        repository
            .findBySecretKey(secretKey)
            .orElseThrow(() -> new ResourceNotFoundException("Secret", secretKey));
    var plaintext =
        apply(
            Cipher.DECRYPT_MODE,
            secretKey,
            decode(secret.getIv()),
            decode(secret.getEncryptedValue()));
    return new String(plaintext, StandardCharsets.UTF_8);
  }

  @Override
  @Transactional
  public void delete(String secretKey) {
    int removed = repository.deleteBySecretKey(secretKey);
    log.debug("Deleted integration secret: key={}, removed={}", secretKey, removed);
  }

  private byte[] apply(int mode, String secretKey, byte[] iv, byte[] input) {
    try {
      var cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(mode, masterKey, new GCMParameterSpec(TAG_BITS, iv));
      cipher.updateAAD(secretKey.getBytes(StandardCharsets.UTF_8));
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(
          (mode == Cipher.ENCRYPT_MODE ? "Encrypting" : "Decrypting")
              + " secret '"
              + secretKey
              + "' failed",
          e);
    }
  }

  private static byte[] decodeMasterKey(String base64Key) {
    if (base64Key == null || base64Key.isBlank()) {
      throw new IllegalStateException(
          "integration.encryption-key (INTEGRATION_ENCRYPTION_KEY) must be set to store tokens");
    }
    var key = decode(base64Key.trim());
    if (key.length != KEY_BYTES) {
      throw new IllegalStateException(
          "integration.encryption-key must be a Base64-encoded 256-bit key, got "
              + key.length
              + " bytes");
    }
    return key;
  }

  private static String encode(byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }

  private static byte[] decode(String value) {
    return Base64.getDecoder().decode(value);
  }
}
