package vpnmanager.adapter.in.validation;

/**
 * Escapes user-supplied text before it is echoed into a response.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {}

    public static String escape(String value) {
        if (value == null) {
            return null;
        }
        final var out = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#x27;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
