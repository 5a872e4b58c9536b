package io.pockethive.phased.parser;

import java.util.List;

/**
 * Tokens between a block tag and its matching end tag.
 *
 * @param tokens     body tokens in source order, nested blocks included verbatim
 * @param terminator the matching end tag token
 */
public record ParsedBlock(List<TemplateToken> tokens, TemplateToken terminator) {

    public ParsedBlock {
        tokens = List.copyOf(tokens);
    }

    /**
     * The body re-serialized to source text.
     */
    public String literal() {
        StringBuilder literal = new StringBuilder();
        for (TemplateToken token : tokens) {
            literal.append(token.source());
        }
        return literal.toString();
    }
}
