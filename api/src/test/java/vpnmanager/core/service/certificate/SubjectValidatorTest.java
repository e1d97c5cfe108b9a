package vpnmanager.core.service.certificate;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import vpnmanager.core.model.common.ValidationResult;

@DisplayName("SubjectValidator")
class SubjectValidatorTest {

    @Nested
    @DisplayName("validateCommonName()")
    class CommonNameTests {

        @ParameterizedTest
        @ValueSource(strings = {"alice@example.com", "gateway-01", "Build Server 2", "host.example.org"})
        @DisplayName("should accept ordinary names")
        void shouldAccept(String cn) {
            assertTrue(SubjectValidator.validateCommonName(cn).isValid());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "-leading", "a,b", "CN=x", "a/b", "a+b"})
        @DisplayName("should reject names that would corrupt the subject")
        void shouldReject(String cn) {
            assertFalse(SubjectValidator.validateCommonName(cn).isValid());
        }

        @Test
        @DisplayName("should flag names longer than 64 characters as too long")
        void shouldFlagTooLong() {
            var result = SubjectValidator.validateCommonName("a".repeat(65));

            assertTrue(result instanceof ValidationResult.Invalid invalid && invalid.tooLong());
        }
    }

    @Nested
    @DisplayName("validateEmail()")
    class EmailTests {

        @Test
        @DisplayName("should treat absent email as valid")
        void shouldAllowAbsent() {
            assertTrue(SubjectValidator.validateEmail(null).isValid());
        }

        @Test
        @DisplayName("should reject malformed email")
        void shouldRejectMalformed() {
            assertFalse(SubjectValidator.validateEmail("not an email").isValid());
        }
    }
}
