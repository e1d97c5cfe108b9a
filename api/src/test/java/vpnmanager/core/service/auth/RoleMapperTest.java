package vpnmanager.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import vpnmanager.core.model.auth.Role;

@DisplayName("RoleMapper")
class RoleMapperTest {

    private final RoleMapper mapper = new RoleMapper(List.of("admins", " vpn-admins "));

    @Test
    @DisplayName("should grant USER to every identity")
    void shouldGrantUser() {
        assertEquals(Set.of(Role.USER), mapper.rolesFor(List.of()));
        assertEquals(Set.of(Role.USER), mapper.rolesFor(null));
    }

    @Test
    @DisplayName("should grant ADMIN for configured groups ignoring case and padding")
    void shouldGrantAdmin() {
        assertEquals(Set.of(Role.USER, Role.ADMIN), mapper.rolesFor(List.of("staff", "VPN-Admins")));
    }

    @Test
    @DisplayName("should not grant ADMIN for similar group names")
    void shouldNotGrantAdminForSimilarNames() {
        assertEquals(Set.of(Role.USER), mapper.rolesFor(List.of("admins-readonly", "admin")));
    }
}
