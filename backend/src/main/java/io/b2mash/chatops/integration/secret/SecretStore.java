package io.b2mash.chatops.integration.secret;

/** Encrypted storage for chat workspace tokens, addressed by a string key. */
public interface SecretStore {

  /** Stores or replaces the secret under {@code secretKey}. */
  void store(String secretKey, String plaintext);

  /**
   * @throws io.b2mash.chatops.exception.ResourceNotFoundException if nothing is stored under the
   *     key
   */
  String retrieve(String secretKey);

  /** Removes the secret; a missing key is not an error. */
  void delete(String secretKey);
}
