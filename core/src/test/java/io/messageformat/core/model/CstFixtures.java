package io.messageformat.core.model;

import io.messageformat.core.cst.Cst;
import java.util.Arrays;
import java.util.List;

/** Small syntax trees for model tests. Source ranges are nominal. */
final class CstFixtures {

    private CstFixtures() {}

    static Cst.Text text(String value) {
        return new Cst.Text(0, value.length(), value);
    }

    static Cst.VariableRef variable(String name) {
        return new Cst.VariableRef(0, name.length() + 1, name);
    }

    static Cst.Literal lit(String value) {
        return new Cst.Literal(0, value.length(), false, value);
    }

    static List<Cst.Syntax> name(String name) {
        int colon = name.indexOf(':');
        if (colon < 0) {
            return List.of(new Cst.Syntax(0, name.length(), name));
        }
        return List.of(
                new Cst.Syntax(0, colon, name.substring(0, colon)),
                new Cst.Syntax(colon, colon + 1, ":"),
                new Cst.Syntax(colon + 1, name.length(), name.substring(colon + 1)));
    }

    static Cst.Option opt(String name, Cst.Node value) {
        return new Cst.Option(0, 0, name(name), value);
    }

    static Cst.FunctionRef fn(String name, Cst.Option... options) {
        return new Cst.FunctionRef(0, 0, new Cst.Syntax(0, 1, ":"), name(name), Arrays.asList(options));
    }

    static Cst.Expression expr(Cst.Node arg, Cst.Node functionRef, Cst.Attribute... attributes) {
        return new Cst.Expression(2, 10, List.of(), arg, functionRef, null, Arrays.asList(attributes));
    }

    static Cst.Expression expr(Cst.Node arg) {
        return expr(arg, null);
    }

    static Cst.Attribute attr(String name, String value) {
        return new Cst.Attribute(0, 0, name(name), value != null ? lit(value) : null);
    }

    static Cst.Expression markup(String sigil, String name, boolean standalone, Cst.Option... options) {
        Cst.Markup markup = new Cst.Markup(
                0,
                0,
                new Cst.Syntax(0, 1, sigil),
                name(name),
                Arrays.asList(options),
                standalone ? new Cst.Syntax(0, 1, "/") : null);
        return new Cst.Expression(0, 0, List.of(), null, null, markup, List.of());
    }

    static Cst.Pattern pattern(Cst.Node... body) {
        return new Cst.Pattern(0, 0, Arrays.asList(body), List.of());
    }

    static Cst.SimpleMessage simple(Cst.Node... body) {
        return new Cst.SimpleMessage(pattern(body), List.of());
    }

    static Cst.InputDeclaration input(Cst.Node value) {
        return new Cst.InputDeclaration(0, 20, new Cst.Syntax(0, 6, ".input"), value);
    }

    static Cst.LocalDeclaration local(Cst.Node target, Cst.Node value) {
        return new Cst.LocalDeclaration(0, 30, new Cst.Syntax(0, 6, ".local"), target, new Cst.Syntax(0, 1, "="), value);
    }

    static Cst.Variant variant(Cst.Pattern value, Cst.Node... keys) {
        return new Cst.Variant(0, 0, Arrays.asList(keys), value);
    }

    static Cst.CatchallKey star() {
        return new Cst.CatchallKey(0, 1);
    }
}
