package vpnmanager;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.out.SessionRepository;
import vpnmanager.core.service.auth.CsrfTokenService;
import vpnmanager.fixtures.Fixtures;

@QuarkusTest
@DisplayName("PSK and Machine Profile Integration Tests")
class MachineProfileIntegrationTest {

    @Inject
    SessionRepository sessions;

    @Inject
    CsrfTokenService csrf;

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private Session login(Session session) {
        sessions.saveIfAbsent(session).await().indefinitely();
        return session;
    }

    private String createPsk(Session admin, String type) {
        return given().cookie("vpn_session", admin.id())
                .contentType(ContentType.URLENC)
                .formParam("csrf_token", csrf.tokenFor(admin))
                .formParam("description", "build host " + type)
                .formParam("psk_type", type)
                .formParam("template_set", "Default")
                .when()
                .post("/admin/psk")
                .then()
                .statusCode(201)
                .extract()
                .path("key");
    }

    @Nested
    @DisplayName("Admin PSK management")
    class AdminPsk {

        @Test
        @DisplayName("Should forbid a regular user")
        void shouldForbidUser() {
            var user = login(Fixtures.user(unique("plain")));

            given().cookie("vpn_session", user.id())
                    .when()
                    .get("/admin/psk")
                    .then()
                    .statusCode(403);
        }

        @Test
        @DisplayName("Should return the plaintext key only on creation")
        void shouldReturnKeyOnCreate() {
            var admin = login(Fixtures.admin(unique("admin")));

            var id = given().cookie("vpn_session", admin.id())
                    .contentType(ContentType.URLENC)
                    .formParam("csrf_token", csrf.tokenFor(admin))
                    .formParam("description", "office desktop")
                    .formParam("psk_type", "computer")
                    .formParam("template_set", "Default")
                    .formParam("ttl_days", "30")
                    .when()
                    .post("/admin/psk")
                    .then()
                    .statusCode(201)
                    .body("key", notNullValue())
                    .body("psk.type", is("computer"))
                    .body("psk.expiresAt", notNullValue())
                    .extract()
                    .<String>path("psk.id");

            given().cookie("vpn_session", admin.id())
                    .when()
                    .get("/admin/psk/" + id)
                    .then()
                    .statusCode(200)
                    .body("id", is(id))
                    .body("key", is((Object) null));
        }

        @Test
        @DisplayName("Should reject an unknown PSK type")
        void shouldRejectUnknownType() {
            var admin = login(Fixtures.admin(unique("admin")));

            given().cookie("vpn_session", admin.id())
                    .contentType(ContentType.URLENC)
                    .formParam("csrf_token", csrf.tokenFor(admin))
                    .formParam("description", "mystery")
                    .formParam("psk_type", "router")
                    .when()
                    .post("/admin/psk")
                    .then()
                    .statusCode(400);
        }
    }

    @Nested
    @DisplayName("Machine endpoints")
    class MachineEndpoints {

        @Test
        @DisplayName("Should reject a request without a bearer key")
        void shouldRejectMissingKey() {
            given().when().get("/api/v1/server/bundle").then().statusCode(401);
        }

        @Test
        @DisplayName("Should reject an unknown key")
        void shouldRejectUnknownKey() {
            given().header("Authorization", "Bearer not-a-real-key")
                    .when()
                    .get("/api/v1/computer/config")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("Should return a server bundle for a server key")
        void shouldReturnServerBundle() {
            var key = createPsk(login(Fixtures.admin(unique("admin"))), "server");

            given().header("Authorization", "Bearer " + key)
                    .when()
                    .get("/api/v1/server/bundle")
                    .then()
                    .statusCode(200)
                    .contentType(containsString("application/zip"))
                    .header("X-Certificate-Fingerprint", notNullValue());
        }

        @Test
        @DisplayName("Should not accept a server key for a computer profile")
        void shouldRejectWrongKeyType() {
            var key = createPsk(login(Fixtures.admin(unique("admin"))), "server");

            given().header("Authorization", "Bearer " + key)
                    .when()
                    .get("/api/v1/computer/config")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("Should stop accepting a key after revocation")
        void shouldRejectRevokedKey() {
            var admin = login(Fixtures.admin(unique("admin")));
            var created = given().cookie("vpn_session", admin.id())
                    .contentType(ContentType.URLENC)
                    .formParam("csrf_token", csrf.tokenFor(admin))
                    .formParam("description", "laptop")
                    .formParam("psk_type", "computer")
                    .formParam("template_set", "Default")
                    .when()
                    .post("/admin/psk")
                    .then()
                    .statusCode(201)
                    .extract()
                    .jsonPath();

            given().header("Authorization", "Bearer " + created.getString("key"))
                    .when()
                    .get("/api/v1/computer/config")
                    .then()
                    .statusCode(200)
                    .body(containsString("<cert>"));

            given().cookie("vpn_session", admin.id())
                    .contentType(ContentType.URLENC)
                    .formParam("csrf_token", csrf.tokenFor(admin))
                    .when()
                    .post("/admin/psk/" + created.getString("psk.id") + "/revoke")
                    .then()
                    .statusCode(200)
                    .body("revoked", is(true));

            given().header("Authorization", "Bearer " + created.getString("key"))
                    .when()
                    .get("/api/v1/computer/config")
                    .then()
                    .statusCode(401);
        }
    }

    @Nested
    @DisplayName("Transparency log")
    class Transparency {

        @Test
        @DisplayName("Should let an admin find machine certificates by type")
        void shouldSearchByType() {
            var admin = login(Fixtures.admin(unique("admin")));
            var key = createPsk(admin, "server");
            var fingerprint = given().header("Authorization", "Bearer " + key)
                    .when()
                    .get("/api/v1/server/bundle")
                    .then()
                    .statusCode(200)
                    .extract()
                    .header("X-Certificate-Fingerprint");

            given().cookie("vpn_session", admin.id())
                    .queryParam("type", "server")
                    .queryParam("limit", "100")
                    .when()
                    .get("/admin/certificates")
                    .then()
                    .statusCode(200)
                    .body("type", is("server"))
                    .body("results.items.fingerprint", hasItem(fingerprint));
        }

        @Test
        @DisplayName("Should reject an unknown type filter")
        void shouldRejectUnknownFilter() {
            var admin = login(Fixtures.admin(unique("admin")));

            given().cookie("vpn_session", admin.id())
                    .queryParam("type", "toaster")
                    .when()
                    .get("/admin/certificates")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("Should clamp an oversized page request")
        void shouldClampPageSize() {
            var user = login(Fixtures.user(unique("viewer")));

            given().cookie("vpn_session", user.id())
                    .queryParam("limit", "5000")
                    .queryParam("page", "-3")
                    .when()
                    .get("/certificates")
                    .then()
                    .statusCode(200)
                    .body("results.page", is(1))
                    .body("results.pageSize", is(100));
        }
    }
}
