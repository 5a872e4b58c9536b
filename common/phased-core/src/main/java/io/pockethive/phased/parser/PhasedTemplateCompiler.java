package io.pockethive.phased.parser;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * First-pass source transformation.
 * <p>
 * Every {@code {% phased [with name ...] %}...{% endphased %}} region is cut out of the template
 * and replaced by a call to the marker function carrying the encoded {@link DeferredBlock}:
 * <pre>
 * A{% phased with x %}B{{ x }}C{% endphased %}D  →  A{{ phased('eyJsaXRlcmFs...') }}D
 * </pre>
 * The rest of the source, including {@code phasedcache} tags, is left for the template engine.
 * {@code verbatim} regions are copied unchanged.
 */
public final class PhasedTemplateCompiler {

    public static final String PHASED_TAG = "phased";
    public static final String END_PHASED_TAG = "endphased";
    public static final String CACHE_TAG = "phasedcache";
    public static final String END_CACHE_TAG = "endphasedcache";
    public static final String MARKER_FUNCTION = "phased";

    private static final String VERBATIM_TAG = "verbatim";
    private static final String END_VERBATIM_TAG = "endverbatim";

    private final TemplateLexer lexer = new TemplateLexer();
    private final DeferredBlockParser blockParser = new DeferredBlockParser();

    public String compile(String source) {
        Objects.requireNonNull(source, "source");
        if (!source.contains("{%")) {
            return source;
        }
        Iterator<TemplateToken> tokens = lexer.tokenize(source).iterator();
        StringBuilder out = new StringBuilder(source.length());
        int cacheDepth = 0;
        while (tokens.hasNext()) {
            TemplateToken token = tokens.next();
            if (token.isTag(PHASED_TAG)) {
                out.append(markerCall(token, tokens));
                continue;
            }
            if (token.isTag(VERBATIM_TAG)) {
                out.append(token.source());
                copyVerbatim(tokens, out);
                continue;
            }
            if (token.isTag(CACHE_TAG)) {
                cacheDepth++;
            } else if (token.isTag(END_CACHE_TAG)) {
                cacheDepth--;
            }
            out.append(token.source());
        }
        if (cacheDepth > 0) {
            throw new UnclosedBlockException(CACHE_TAG, END_CACHE_TAG);
        }
        return out.toString();
    }

    /**
     * Reads the arguments of a {@code phased} tag.
     *
     * @throws PhasedSyntaxException when the second word is not {@code with} or no names follow it
     */
    public List<String> phasedArguments(TemplateToken tag) {
        List<String> words = TagArguments.split(tag.contents());
        if (words.size() > 1 && !"with".equals(words.get(1))) {
            throw new PhasedSyntaxException(
                "'" + words.get(0) + "' tag requires the second argument to be 'with'", tag.lineNumber());
        }
        if (words.size() == 2) {
            throw new PhasedSyntaxException(
                "'" + words.get(0) + "' tag requires at least one context variable name", tag.lineNumber());
        }
        return words.size() > 2 ? words.subList(2, words.size()) : List.of();
    }

    private String markerCall(TemplateToken open, Iterator<TemplateToken> tokens) {
        List<String> names = phasedArguments(open);
        ParsedBlock body = blockParser.parse(tokens, PHASED_TAG, END_PHASED_TAG);
        String literal = body.literal();
        if (open.trimsAfter()) {
            literal = literal.stripLeading();
        }
        if (body.terminator().trimsBefore()) {
            literal = literal.stripTrailing();
        }
        DeferredBlock block = new DeferredBlock(literal, names);
        return (open.trimsBefore() ? "{{- " : "{{ ")
            + MARKER_FUNCTION + "('" + block.encode() + "')"
            + (body.terminator().trimsAfter() ? " -}}" : " }}");
    }

    private static void copyVerbatim(Iterator<TemplateToken> tokens, StringBuilder out) {
        while (tokens.hasNext()) {
            TemplateToken token = tokens.next();
            out.append(token.source());
            if (token.isTag(END_VERBATIM_TAG)) {
                return;
            }
        }
    }
}
