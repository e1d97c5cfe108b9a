package vpnmanager.core.service.auth;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import vpnmanager.core.config.OidcConfig;
import vpnmanager.core.model.auth.Role;

/**
 * Maps identity provider groups to roles.
 *
 * <p>Every authenticated identity holds {@link Role#USER}. Membership in any
 * configured admin group adds {@link Role#ADMIN}. Group names compare case-insensitively.
 */
@ApplicationScoped
public class RoleMapper {

    private final Set<String> adminGroups;

    @Inject
    public RoleMapper(OidcConfig config) {
        this(config.adminGroups());
    }

    RoleMapper(Collection<String> adminGroups) {
        this.adminGroups = adminGroups.stream()
                .map(String::trim)
                .filter(g -> !g.isEmpty())
                .map(g -> g.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<Role> rolesFor(Collection<String> groups) {
        final var roles = EnumSet.of(Role.USER);
        if (groups != null
                && groups.stream().filter(g -> g != null).anyMatch(g -> adminGroups.contains(g.toLowerCase(Locale.ROOT)))) {
            roles.add(Role.ADMIN);
        }
        return roles;
    }
}
