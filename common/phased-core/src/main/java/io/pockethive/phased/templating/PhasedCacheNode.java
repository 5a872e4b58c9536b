package io.pockethive.phased.templating;

import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.extension.NodeVisitor;
import com.mitchellbosecke.pebble.node.AbstractRenderableNode;
import com.mitchellbosecke.pebble.node.BodyNode;
import com.mitchellbosecke.pebble.node.expression.Expression;
import com.mitchellbosecke.pebble.template.EvaluationContextImpl;
import com.mitchellbosecke.pebble.template.PebbleTemplateImpl;
import io.pockethive.phased.cache.FragmentCache;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class PhasedCacheNode extends AbstractRenderableNode {

    private final Expression<?> expiration;
    private final String fragmentName;
    private final List<Expression<?>> varyOn;
    private final BodyNode body;
    private final FragmentCache fragmentCache;

    PhasedCacheNode(int lineNumber,
                    Expression<?> expiration,
                    String fragmentName,
                    List<Expression<?>> varyOn,
                    BodyNode body,
                    FragmentCache fragmentCache) {
        super(lineNumber);
        this.expiration = expiration;
        this.fragmentName = fragmentName;
        this.varyOn = List.copyOf(varyOn);
        this.body = body;
        this.fragmentCache = fragmentCache;
    }

    @Override
    public void render(PebbleTemplateImpl self, Writer writer, EvaluationContextImpl context) throws IOException {
        Duration ttl = toTtl(expiration.evaluate(self, context), self);
        List<Object> varyValues = new ArrayList<>(varyOn.size());
        for (Expression<?> expression : varyOn) {
            varyValues.add(expression.evaluate(self, context));
        }
        String text;
        try {
            text = fragmentCache.getOrRender(
                fragmentName,
                varyValues,
                ttl,
                () -> renderBody(self, context),
                PhasedPebbleExtension.ambientContext(context));
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
        writer.write(text);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    private String renderBody(PebbleTemplateImpl self, EvaluationContextImpl context) {
        StringWriter buffer = new StringWriter();
        try {
            body.render(self, buffer, context);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return buffer.toString();
    }

    private Duration toTtl(Object value, PebbleTemplateImpl self) {
        if (value == null) {
            return Duration.ZERO;
        }
        if (value instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.toString().trim()));
        } catch (NumberFormatException ex) {
            throw new PebbleException(ex, "'phasedcache' tag got a non-integer timeout value: " + value,
                getLineNumber(), self.getName());
        }
    }
}
