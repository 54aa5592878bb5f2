package com.dataexchange.exchangeapi.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps Keycloak-style {@code realm_access.roles} and {@code resource_access.exchange-api.roles}
 * claims to {@code ROLE_*} authorities, on top of the standard scope authorities.
 */
public class RealmRoleGrantedAuthoritiesConverter
    implements Converter<Jwt, Collection<GrantedAuthority>> {
  static final String API_CLIENT_ID = "exchange-api";

  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();
    Collection<GrantedAuthority> scopes = scopeConverter.convert(jwt);
    if (scopes != null) {
      authorities.addAll(scopes);
    }

    Object realmAccess = jwt.getClaims().get("realm_access");
    addRoles(authorities, rolesOf(realmAccess));

    Object resourceAccess = jwt.getClaims().get("resource_access");
    if (resourceAccess instanceof Map<?, ?> clients) {
      addRoles(authorities, rolesOf(clients.get(API_CLIENT_ID)));
    }
    return authorities;
  }

  private static List<String> rolesOf(Object accessClaim) {
    if (accessClaim instanceof Map<?, ?> access
        && access.get("roles") instanceof Collection<?> roles) {
      return roles.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }
    return List.of();
  }

  private static void addRoles(Set<GrantedAuthority> authorities, List<String> roles) {
    for (String role : roles) {
      if (!role.isBlank()) {
        authorities.add(new SimpleGrantedAuthority("ROLE_" + role.trim().toUpperCase()));
      }
    }
  }
}
