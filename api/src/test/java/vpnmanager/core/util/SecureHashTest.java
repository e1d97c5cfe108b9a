package vpnmanager.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Nested
    @DisplayName("sha256Hex")
    class Sha256HexTests {

        @Test
        @DisplayName("should match the published SHA-256 digest of abc")
        void shouldMatchKnownDigest() {
            assertEquals(
                    "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", SecureHash.sha256Hex("abc"));
        }

        @Test
        @DisplayName("should hash strings and their UTF-8 bytes identically")
        void shouldHashBytesLikeStrings() {
            assertEquals(
                    SecureHash.sha256Hex("psk-secret"),
                    SecureHash.sha256Hex("psk-secret".getBytes(StandardCharsets.UTF_8)));
        }
    }

    @Nested
    @DisplayName("truncatedSha256")
    class TruncatedSha256Tests {

        @Test
        @DisplayName("should return a prefix of the full digest")
        void shouldReturnPrefix() {
            assertEquals("ba7816bf", SecureHash.truncatedSha256("abc", 8));
        }

        @Test
        @DisplayName("should return none for null input")
        void shouldHandleNull() {
            assertEquals("none", SecureHash.truncatedSha256(null, 8));
        }

        @Test
        @DisplayName("should reject lengths outside 1-64")
        void shouldRejectBadLength() {
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 0));
            assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 65));
        }
    }

    @Nested
    @DisplayName("constantTimeEquals")
    class ConstantTimeEqualsTests {

        @Test
        @DisplayName("should compare by content")
        void shouldCompareContent() {
            assertTrue(SecureHash.constantTimeEquals("token", new String("token")));
            assertFalse(SecureHash.constantTimeEquals("token", "tokem"));
            assertFalse(SecureHash.constantTimeEquals("token", "token-longer"));
        }

        @Test
        @DisplayName("should treat null as unequal")
        void shouldRejectNull() {
            assertFalse(SecureHash.constantTimeEquals(null, null));
            assertFalse(SecureHash.constantTimeEquals("token", null));
        }
    }
}
