package io.b2mash.chatops.security;

import java.util.Map;
import java.util.Optional;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * The active organization carried in the token's {@code o} claim, e.g. {@code {"o": {"id":
 * "6f1c...", "rol": "admin"}}}.
 */
public record OrgClaim(String id, String role) {

  static final String CLAIM_NAME = "o";

  public static Optional<OrgClaim> from(Jwt jwt) {
    if (!(jwt.getClaim(CLAIM_NAME) instanceof Map<?, ?> claim)) {
      return Optional.empty();
    }
    return Optional.of(new OrgClaim(asString(claim.get("id")), asString(claim.get("rol"))));
  }

  private static String asString(Object value) {
    return value instanceof String str ? str : null;
  }
}
