package io.b2mash.chatops.security;

import java.util.Map;
import java.util.Optional;

/**
 * Org role names as they appear in the {@code o.rol} claim, and the Spring authorities they grant.
 * Controllers check the authorities through {@code hasAnyRole('ORG_...')}.
 */
public final class Roles {

  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_MEMBER = "ROLE_ORG_MEMBER";

  private static final Map<String, String> AUTHORITIES =
      Map.of(
          ORG_OWNER, AUTHORITY_ORG_OWNER,
          ORG_ADMIN, AUTHORITY_ORG_ADMIN,
          ORG_MEMBER, AUTHORITY_ORG_MEMBER);

  private Roles() {}

  public static Optional<String> authorityFor(String orgRole) {
    return orgRole == null ? Optional.empty() : Optional.ofNullable(AUTHORITIES.get(orgRole));
  }
}
