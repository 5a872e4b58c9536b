package io.pockethive.phased.parser;

/**
 * One lexical unit of template source.
 *
 * @param type        token kind
 * @param source      the raw source text, byte-for-byte as written
 * @param contents    inner contents without delimiters, whitespace-control dashes and
 *                    surrounding whitespace ({@link Type#TEXT} tokens carry their text)
 * @param lineNumber  1-based line the token starts on
 * @param trimsBefore opening delimiter carries a whitespace-control dash ({@code {%-})
 * @param trimsAfter  closing delimiter carries a whitespace-control dash ({@code -%}})
 */
public record TemplateToken(
    Type type,
    String source,
    String contents,
    int lineNumber,
    boolean trimsBefore,
    boolean trimsAfter
) {

    public enum Type {
        TEXT,
        VARIABLE,
        BLOCK,
        COMMENT
    }

    /**
     * First word of a block tag, or an empty string for other token types.
     */
    public String tagName() {
        if (type != Type.BLOCK) {
            return "";
        }
        int end = 0;
        while (end < contents.length() && !Character.isWhitespace(contents.charAt(end))) {
            end++;
        }
        return contents.substring(0, end);
    }

    public boolean isTag(String name) {
        return type == Type.BLOCK && tagName().equals(name);
    }
}
