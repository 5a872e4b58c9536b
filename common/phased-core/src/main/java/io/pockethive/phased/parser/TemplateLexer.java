package io.pockethive.phased.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template source into text, {@code {{ }}}, {@code {% %}} and {@code {# #}} tokens.
 * <p>
 * Tags end at the first matching closing delimiter, so a closing delimiter inside a string
 * literal of a tag ends the tag early.
 */
public final class TemplateLexer {

    private static final Pattern TAG = Pattern.compile("\\{\\{.*?\\}\\}|\\{%.*?%\\}|\\{#.*?#\\}", Pattern.DOTALL);

    public List<TemplateToken> tokenize(String source) {
        Objects.requireNonNull(source, "source");
        List<TemplateToken> tokens = new ArrayList<>();
        Matcher matcher = TAG.matcher(source);
        int position = 0;
        int line = 1;
        while (matcher.find()) {
            if (matcher.start() > position) {
                String text = source.substring(position, matcher.start());
                tokens.add(new TemplateToken(TemplateToken.Type.TEXT, text, text, line, false, false));
                line += countLines(text);
            }
            String raw = matcher.group();
            tokens.add(tagToken(raw, line));
            line += countLines(raw);
            position = matcher.end();
        }
        if (position < source.length()) {
            String text = source.substring(position);
            tokens.add(new TemplateToken(TemplateToken.Type.TEXT, text, text, line, false, false));
        }
        return tokens;
    }

    private static TemplateToken tagToken(String raw, int line) {
        TemplateToken.Type type = switch (raw.charAt(1)) {
            case '{' -> TemplateToken.Type.VARIABLE;
            case '%' -> TemplateToken.Type.BLOCK;
            default -> TemplateToken.Type.COMMENT;
        };
        String inner = raw.substring(2, raw.length() - 2);
        boolean trimsBefore = inner.startsWith("-");
        boolean trimsAfter = inner.length() > (trimsBefore ? 1 : 0) && inner.endsWith("-");
        int from = trimsBefore ? 1 : 0;
        int to = trimsAfter ? inner.length() - 1 : inner.length();
        String contents = inner.substring(from, Math.max(from, to)).strip();
        return new TemplateToken(type, raw, contents, line, trimsBefore, trimsAfter);
    }

    private static int countLines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
