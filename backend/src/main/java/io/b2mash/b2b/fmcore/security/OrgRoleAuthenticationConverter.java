package io.b2mash.b2b.fmcore.security;

import io.b2mash.b2b.fmcore.actor.ActorRole;
import java.util.Collection;
import java.util.List;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class OrgRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    return ActorRole.fromClaim(OrgClaims.extractOrgRole(jwt))
        .<Collection<GrantedAuthority>>map(
            role -> List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_PREFIX + role.name())))
        .orElse(List.of());
  }
}
