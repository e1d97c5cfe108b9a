package vpnmanager.adapter.in.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PaginationParser")
class PaginationParserTest {

    @Nested
    @DisplayName("page()")
    class PageTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "abc", "-3", "0", "1.5", "+2", "2; DROP TABLE"})
        @DisplayName("should fall back to the first page for unusable values")
        void shouldFallBackToFirstPage(String raw) {
            assertEquals(1, PaginationParser.page(raw));
        }

        @Test
        @DisplayName("should accept a positive page number")
        void shouldAcceptPositivePage() {
            assertEquals(7, PaginationParser.page(" 7 "));
        }

        @Test
        @DisplayName("should saturate huge page numbers")
        void shouldSaturateHugePages() {
            assertEquals(Integer.MAX_VALUE, PaginationParser.page("99999999999999999999"));
        }
    }

    @Nested
    @DisplayName("size()")
    class SizeTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"x", "-10", "0"})
        @DisplayName("should ask for the default size for unusable values")
        void shouldUseDefaultSize(String raw) {
            assertEquals(PaginationParser.DEFAULT_SIZE, PaginationParser.size(raw));
        }

        @Test
        @DisplayName("should pass large sizes through for the core to clamp")
        void shouldPassLargeSizesThrough() {
            assertEquals(5000, PaginationParser.size("5000"));
        }
    }
}
