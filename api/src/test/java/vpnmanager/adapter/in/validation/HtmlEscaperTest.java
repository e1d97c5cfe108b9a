package vpnmanager.adapter.in.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlEscaper")
class HtmlEscaperTest {

    @Test
    @DisplayName("should escape markup characters")
    void shouldEscapeMarkup() {
        assertEquals("&lt;script&gt;alert(&quot;x&quot;)&lt;/script&gt;",
                HtmlEscaper.escape("<script>alert(\"x\")</script>"));
    }

    @Test
    @DisplayName("should escape ampersands and single quotes")
    void shouldEscapeAmpersandsAndQuotes() {
        assertEquals("Tom &amp; Jerry&#x27;s", HtmlEscaper.escape("Tom & Jerry's"));
    }

    @Test
    @DisplayName("should pass null through")
    void shouldPassNullThrough() {
        assertNull(HtmlEscaper.escape(null));
    }
}
