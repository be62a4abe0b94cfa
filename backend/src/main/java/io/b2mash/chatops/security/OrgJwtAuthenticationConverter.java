package io.b2mash.chatops.security;

import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/** Grants exactly one org authority from the token's {@code o.rol}; unknown roles grant none. */
@Component
public class OrgJwtAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    var authorities =
        OrgClaim.from(jwt)
            .flatMap(claim -> Roles.authorityFor(claim.role()))
            .map(authority -> List.of(new SimpleGrantedAuthority(authority)))
            .orElse(List.of());
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }
}
