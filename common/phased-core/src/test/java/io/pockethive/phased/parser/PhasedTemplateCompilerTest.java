package io.pockethive.phased.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class PhasedTemplateCompilerTest {

    private static final Pattern CALL = Pattern.compile("\\{\\{-? phased\\('([A-Za-z0-9_-]+)'\\) -?}}");

    private final PhasedTemplateCompiler compiler = new PhasedTemplateCompiler();

    @Test
    void leavesTemplatesWithoutTagsUntouched() {
        assertThat(compiler.compile("Hello {{ name }}")).isEqualTo("Hello {{ name }}");
    }

    @Test
    void replacesPhasedBlockWithMarkerCall() {
        String compiled = compiler.compile("A{% phased with x %}B{{ x }}C{% endphased %}D");

        assertThat(compiled).startsWith("A{{ phased('").endsWith("') }}D");
        DeferredBlock block = onlyBlock(compiled);
        assertThat(block.literal()).isEqualTo("B{{ x }}C");
        assertThat(block.variableNames()).containsExactly("x");
    }

    @Test
    void outerBlockCarriesNestedBlockAsLiteral() {
        String compiled = compiler.compile(
            "[{% phased with a %}{{ a }}({% phased with b %}{{ b }}{% endphased %}){% endphased %}]");

        DeferredBlock block = onlyBlock(compiled);
        assertThat(block.literal()).isEqualTo("{{ a }}({% phased with b %}{{ b }}{% endphased %})");
        assertThat(compiled).startsWith("[").endsWith("]");
    }

    @Test
    void carriesWhitespaceControlFlags() {
        String compiled = compiler.compile("a {%- phased -%}  x  {%- endphased -%} b");

        assertThat(compiled).startsWith("a {{- phased('").endsWith("') -}} b");
        assertThat(onlyBlock(compiled).literal()).isEqualTo("x");
    }

    @Test
    void keepsQuotedNames() {
        String compiled = compiler.compile("{% phased with a \"b c\" 'd.e' user.name %}{% endphased %}");

        assertThat(onlyBlock(compiled).variableNames())
            .containsExactly("a", "\"b c\"", "'d.e'", "user.name");
    }

    @Test
    void rejectsSecondArgumentOtherThanWith() {
        assertThatThrownBy(() -> compiler.compile("\n{% phased using x %}{% endphased %}"))
            .isInstanceOf(PhasedSyntaxException.class)
            .hasMessageContaining("'with'")
            .extracting(ex -> ((PhasedSyntaxException) ex).lineNumber())
            .isEqualTo(2);
    }

    @Test
    void rejectsWithWithoutNames() {
        assertThatThrownBy(() -> compiler.compile("{% phased with %}{% endphased %}"))
            .isInstanceOf(PhasedSyntaxException.class)
            .hasMessageContaining("at least one context variable");
    }

    @Test
    void unclosedPhasedBlockFails() {
        assertThatThrownBy(() -> compiler.compile("A{% phased %}B"))
            .isInstanceOf(UnclosedBlockException.class)
            .hasMessage("Unclosed 'phased' tag. Looking for one of: endphased");
    }

    @Test
    void unclosedCacheBlockFails() {
        assertThatThrownBy(() -> compiler.compile("{% phasedcache 10 box %}x"))
            .isInstanceOf(UnclosedBlockException.class)
            .hasMessageContaining("endphasedcache");
    }

    @Test
    void leavesVerbatimRegionsAlone() {
        String source = "{% verbatim %}{% phased %}x{% endphased %}{% endverbatim %}";

        assertThat(compiler.compile(source)).isEqualTo(source);
    }

    @Test
    void leavesCacheTagsForTheEngine() {
        String source = "{% phasedcache 30 sidebar user.id %}s{% endphasedcache %}";

        assertThat(compiler.compile(source)).isEqualTo(source);
    }

    @Test
    void deferredBlockSurvivesEncoding() {
        DeferredBlock block = new DeferredBlock("{{ 'quoted' }} \"x\"", List.of("a", "'b'"));

        assertThat(DeferredBlock.decode(block.encode())).isEqualTo(block);
        assertThat(block.encode()).matches("[A-Za-z0-9_-]+");
    }

    private static DeferredBlock onlyBlock(String compiled) {
        Matcher matcher = CALL.matcher(compiled);
        assertThat(matcher.find()).as("marker call in %s", compiled).isTrue();
        DeferredBlock block = DeferredBlock.decode(matcher.group(1));
        assertThat(matcher.find()).isFalse();
        return block;
    }
}
