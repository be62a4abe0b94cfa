package io.b2mash.chatops.security;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Checks that an org-scoped request targets the organization the caller's token is issued for.
 * Used from {@code @PreAuthorize} as {@code @organizationAccess.isCurrent(authentication, #id)}.
 */
@Component("organizationAccess")
public class OrganizationAccess {

  private static final Logger log = LoggerFactory.getLogger(OrganizationAccess.class);

  static final String USER_ID_CLAIM = "uid";

  public boolean isCurrent(Authentication authentication, UUID organizationId) {
    if (!(authentication instanceof JwtAuthenticationToken token) || organizationId == null) {
      return false;
    }
    var tokenOrgId = OrgClaim.from(token.getToken()).map(OrgClaim::id).orElse(null);
    boolean matches = organizationId.toString().equalsIgnoreCase(tokenOrgId);
    if (!matches) {
      log.warn(
          "Organization mismatch: subject={}, tokenOrgId={}, requestedOrgId={}",
          token.getName(),
          tokenOrgId,
          organizationId);
    }
    return matches;
  }

  /**
   * Org admins and owners manage any member's or team's settings. Other members only manage their
   * own, identified by the token's numeric {@code uid} claim.
   */
  public boolean canManageSettingsOf(Authentication authentication, Long userId) {
    if (!(authentication instanceof JwtAuthenticationToken token)) {
      return false;
    }
    boolean admin =
        token.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch(
                authority ->
                    Roles.AUTHORITY_ORG_ADMIN.equals(authority)
                        || Roles.AUTHORITY_ORG_OWNER.equals(authority));
    if (admin) {
      return true;
    }
    var callerId = platformUserId(token.getToken());
    boolean self = userId != null && userId.equals(callerId);
    if (!self) {
      log.warn(
          "Settings access denied: subject={}, callerUserId={}, requestedUserId={}",
          token.getName(),
          callerId,
          userId);
    }
    return self;
  }

  private static Long platformUserId(Jwt jwt) {
    Object claim = jwt.getClaim(USER_ID_CLAIM);
    if (claim instanceof Number number) {
      return number.longValue();
    }
    if (claim instanceof String str) {
      try {
        return Long.valueOf(str);
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric {} claim: {}", USER_ID_CLAIM, str);
      }
    }
    return null;
  }
}
