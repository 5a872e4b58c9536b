package io.pockethive.phased.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Collects the body of a block tag without interpreting it.
 * <p>
 * Nesting is tracked with a depth counter over the flat token stream: a nested {@code beginTag}
 * raises the depth, an {@code endTag} lowers it, and the block ends at the {@code endTag} that
 * would take the depth below zero.
 */
public final class DeferredBlockParser {

    /**
     * Consumes tokens up to and including the end tag matching an already consumed begin tag.
     *
     * @param tokens   cursor positioned just after the begin tag
     * @param beginTag tag name opening a block of this kind
     * @param endTag   tag name closing a block of this kind
     * @return the body (excluding the terminating end tag) and the end tag itself
     * @throws UnclosedBlockException when the stream ends first
     */
    public ParsedBlock parse(Iterator<TemplateToken> tokens, String beginTag, String endTag) {
        Objects.requireNonNull(tokens, "tokens");
        List<TemplateToken> body = new ArrayList<>();
        int depth = 0;
        while (tokens.hasNext()) {
            TemplateToken token = tokens.next();
            if (token.isTag(beginTag)) {
                depth++;
            } else if (token.isTag(endTag)) {
                depth--;
                if (depth < 0) {
                    return new ParsedBlock(body, token);
                }
            }
            body.add(token);
        }
        throw new UnclosedBlockException(beginTag, endTag);
    }
}
