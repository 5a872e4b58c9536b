package io.pockethive.phased.templating;

import com.mitchellbosecke.pebble.error.ParserException;
import com.mitchellbosecke.pebble.lexer.Token;
import com.mitchellbosecke.pebble.lexer.TokenStream;
import com.mitchellbosecke.pebble.node.BodyNode;
import com.mitchellbosecke.pebble.node.RenderableNode;
import com.mitchellbosecke.pebble.node.expression.Expression;
import com.mitchellbosecke.pebble.parser.Parser;
import com.mitchellbosecke.pebble.tokenParser.TokenParser;
import io.pockethive.phased.cache.FragmentCache;
import io.pockethive.phased.parser.PhasedTemplateCompiler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses {@code {% phasedcache <expire-seconds> <fragment-name> [vary-expr ...] %}}. The fragment
 * name is a bare identifier or a string literal; expiration and vary values are expressions.
 */
final class PhasedCacheTokenParser implements TokenParser {

    private final FragmentCache fragmentCache;

    PhasedCacheTokenParser(FragmentCache fragmentCache) {
        this.fragmentCache = Objects.requireNonNull(fragmentCache, "fragmentCache");
    }

    @Override
    public String getTag() {
        return PhasedTemplateCompiler.CACHE_TAG;
    }

    @Override
    public RenderableNode parse(Token token, Parser parser) {
        TokenStream stream = parser.getStream();
        int lineNumber = token.getLineNumber();

        // skip the 'phasedcache' token
        stream.next();
        Expression<?> expiration = parser.getExpressionParser().parseExpression();

        Token nameToken = stream.current();
        if (!nameToken.test(Token.Type.NAME) && !nameToken.test(Token.Type.STRING)) {
            throw new ParserException(null, "'" + getTag() + "' tag requires a fragment name",
                nameToken.getLineNumber(), stream.getFilename());
        }
        String fragmentName = nameToken.getValue();
        stream.next();

        List<Expression<?>> varyOn = new ArrayList<>();
        while (!stream.current().test(Token.Type.EXECUTE_END)) {
            varyOn.add(parser.getExpressionParser().parseExpression());
        }
        stream.expect(Token.Type.EXECUTE_END);

        BodyNode body = parser.subparse(tkn -> tkn.test(Token.Type.NAME, PhasedTemplateCompiler.END_CACHE_TAG));

        // skip the 'endphasedcache' token
        stream.next();
        stream.expect(Token.Type.EXECUTE_END);
        return new PhasedCacheNode(lineNumber, expiration, fragmentName, varyOn, body, fragmentCache);
    }
}
