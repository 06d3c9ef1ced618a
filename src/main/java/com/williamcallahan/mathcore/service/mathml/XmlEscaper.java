package com.williamcallahan.mathcore.service.mathml;

/**
 * XML escaping for element content and double-quoted attribute values.
 */
public final class XmlEscaper {

    private XmlEscaper() {
    }

    /**
     * Escapes text placed between tags.
     *
     * @param text raw text, may be null
     * @return text with {@code &}, {@code <} and {@code >} replaced by entities
     */
    public static String content(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        appendContent(escaped, text);
        return escaped.toString();
    }

    /**
     * Escapes text placed inside a double-quoted attribute.
     *
     * @param text raw text, may be null
     * @return text with {@code &}, {@code "}, {@code <} and {@code >} replaced by entities
     */
    public static String attribute(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                escaped.append("&quot;");
            } else {
                appendContentChar(escaped, c);
            }
        }
        return escaped.toString();
    }

    static void appendContent(StringBuilder out, String text) {
        for (int i = 0; i < text.length(); i++) {
            appendContentChar(out, text.charAt(i));
        }
    }

    private static void appendContentChar(StringBuilder out, char c) {
        switch (c) {
            case '&' -> out.append("&amp;");
            case '<' -> out.append("&lt;");
            case '>' -> out.append("&gt;");
            default -> out.append(c);
        }
    }
}
