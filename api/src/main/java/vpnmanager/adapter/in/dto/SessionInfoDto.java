package vpnmanager.adapter.in.dto;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import vpnmanager.core.model.session.Session;

/**
 * DTO describing the caller's session.
 *
 * @param csrfToken token to send with state-changing requests
 */
public record SessionInfoDto(
        String subject, String displayName, String email, Set<String> roles, Instant expiresAt, String csrfToken) {

    public static SessionInfoDto fromModel(Session session, String csrfToken) {
        final Set<String> roles = new TreeSet<>();
        session.roles().forEach(role -> roles.add(role.name().toLowerCase(Locale.ROOT)));
        return new SessionInfoDto(
                session.subject(), session.displayName(), session.email(), roles, session.expiresAt(), csrfToken);
    }
}
