package io.messageformat.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.messageformat.core.value.NumberValue;
import io.messageformat.core.value.StringValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link MessageStringifier}. */
class MessageStringifierTest {

    private static Pattern pattern(PatternElement... elements) {
        return new Pattern(List.of(elements));
    }

    @Test
    void simplePatternIsUnquoted() {
        Message message = new Message.PatternMessage(List.of(), pattern(
                new TextElement("Hello "),
                new Expression(new VariableRef("name"), null),
                new TextElement("!")));

        assertThat(MessageStringifier.stringify(message)).isEqualTo("Hello {$name}!");
    }

    @Test
    void textEscapes() {
        Message message = new Message.PatternMessage(List.of(), pattern(new TextElement("a{b}c\\d")));

        assertThat(MessageStringifier.stringify(message)).isEqualTo("a\\{b\\}c\\\\d");
    }

    @Test
    void leadingDotForcesQuotedPattern() {
        Message message = new Message.PatternMessage(List.of(), pattern(new TextElement("  .dot")));

        assertThat(MessageStringifier.stringify(message)).isEqualTo("{{  .dot}}");
    }

    @Test
    void declarationsAndQuotedPattern() {
        Map<String, Argument> options = new LinkedHashMap<>();
        options.put("minimumFractionDigits", new Literal("2"));
        options.put("signDisplay", new VariableRef("sign"));
        Message message = new Message.PatternMessage(
                List.of(
                        new Declaration.InputDeclaration(
                                "n", new Expression(new VariableRef("n"), new FunctionRef("number", options))),
                        new Declaration.LocalDeclaration(
                                "m", new Expression(new VariableRef("n"), new FunctionRef("integer")))),
                pattern(new Expression(new VariableRef("m"), null)));

        assertThat(MessageStringifier.stringify(message)).isEqualTo(
                ".input {$n :number minimumFractionDigits=2 signDisplay=$sign}\n"
                        + ".local $m = {$n :integer}\n"
                        + "{{{$m}}}");
    }

    @Test
    void selectMessage() {
        Message message = new Message.SelectMessage(
                List.of(new Declaration.InputDeclaration(
                        "count", new Expression(new VariableRef("count"), new FunctionRef("number")))),
                List.of(new VariableRef("count")),
                List.of(
                        new Variant(List.of(new Literal("one")), pattern(new TextElement("one item"))),
                        new Variant(List.of(CatchallKey.INSTANCE), pattern(
                                new Expression(new VariableRef("count"), null), new TextElement(" items")))));

        assertThat(MessageStringifier.stringify(message)).isEqualTo(
                ".input {$count :number}\n"
                        + ".match $count\n"
                        + "one {{one item}}\n"
                        + "* {{{$count} items}}");
    }

    @Test
    void attributesAndMarkup() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", new Literal("greeting"));
        attributes.put("translate", Boolean.TRUE);
        Message message = new Message.PatternMessage(List.of(), pattern(
                new Markup(Markup.Kind.OPEN, "b", Map.of("class", new Literal("x")), Map.of()),
                new Expression(new Literal("hi there"), new FunctionRef("string"), attributes),
                new Markup(Markup.Kind.CLOSE, "b", Map.of(), Map.of()),
                new Markup(Markup.Kind.STANDALONE, "br", Map.of(), Map.of())));

        assertThat(MessageStringifier.stringify(message))
                .isEqualTo("{#b class=x}{|hi there| :string @id=greeting @translate}{/b}{#br /}");
    }

    @Test
    void resolvedArgumentsUseTheirSource() {
        Expression withSource = new Expression(
                new ResolvedArgument(new NumberValue(5, "en", "$five", Map.of())), null);
        Expression withoutSource = new Expression(
                new ResolvedArgument(new StringValue("a b", "en", "")), null);

        assertThat(MessageStringifier.expression(withSource)).isEqualTo("{$five}");
        assertThat(MessageStringifier.expression(withoutSource)).isEqualTo("{|a b|}");
    }

    @ParameterizedTest(name = "[{0}] -> [{1}]")
    @CsvSource(value = {
        "abc;abc",
        "1.5;1.5",
        "-x;-x",
        "'';||",
        ".5;|.5|",
        "a b;|a b|",
        "a|b;|a\\|b|",
        "a\\b;|a\\\\b|",
        "{x};|{x}|",
        "a:b;|a:b|",
        "@x;|@x|"
    }, delimiter = ';')
    void literalQuoting(String value, String expected) {
        assertThat(MessageStringifier.literal(value)).isEqualTo(expected);
    }
}
