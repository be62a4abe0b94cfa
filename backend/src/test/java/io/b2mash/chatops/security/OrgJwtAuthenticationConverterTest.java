package io.b2mash.chatops.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class OrgJwtAuthenticationConverterTest {

  private final OrgJwtAuthenticationConverter converter = new OrgJwtAuthenticationConverter();

  private static Jwt jwt(Map<String, Object> orgClaim) {
    var builder = Jwt.withTokenValue("token").header("alg", "none").subject("user_42");
    if (orgClaim != null) {
      builder.claim("o", orgClaim);
    }
    return builder.build();
  }

  @Test
  void admin_role_grants_admin_authority() {
    var auth = converter.convert(jwt(Map.of("id", "org-1", "rol", "admin")));

    assertThat(auth.getName()).isEqualTo("user_42");
    assertThat(auth.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_ORG_ADMIN);
  }

  @Test
  void unknown_role_grants_nothing() {
    var auth = converter.convert(jwt(Map.of("id", "org-1", "rol", "guest")));

    assertThat(auth.getAuthorities()).isEmpty();
  }

  @Test
  void token_without_org_claim_grants_nothing() {
    assertThat(converter.convert(jwt(null)).getAuthorities()).isEmpty();
  }
}
