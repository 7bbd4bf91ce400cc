package com.terradrift.core.source.terraform;

import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.ListValue;
import com.terradrift.core.model.ConfigValue.MapValue;
import com.terradrift.core.model.ConfigValue.NumberValue;
import com.terradrift.core.parser.HclBaseVisitor;
import com.terradrift.core.parser.HclParser;
import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates HCL expressions that are literal values.
 *
 * <p>Numbers, booleans, {@code null}, strings and heredocs without interpolation, and tuples
 * and objects built only from those evaluate to a value. Everything else (references, function
 * calls, interpolation, operators, conditionals, for expressions, splats) yields
 * {@link Optional#empty()}. A negated number literal counts as a literal.
 */
class HclValueEvaluator extends HclBaseVisitor<Optional<ConfigValue>> {

    static final HclValueEvaluator INSTANCE = new HclValueEvaluator();

    @Override
    protected Optional<ConfigValue> defaultResult() {
        return Optional.empty();
    }

    @Override
    public Optional<ConfigValue> visitChildren(RuleNode node) {
        return Optional.empty();
    }

    @Override
    public Optional<ConfigValue> visitTermExpression(HclParser.TermExpressionContext ctx) {
        return visit(ctx.exprTerm());
    }

    @Override
    public Optional<ConfigValue> visitUnaryExpression(HclParser.UnaryExpressionContext ctx) {
        if (!"-".equals(ctx.op.getText())) {
            return Optional.empty();
        }
        return visit(ctx.expression())
            .filter(NumberValue.class::isInstance)
            .map(value -> ConfigValue.of(-((NumberValue) value).value()));
    }

    @Override
    public Optional<ConfigValue> visitParenthesizedTerm(HclParser.ParenthesizedTermContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Optional<ConfigValue> visitLiteralTerm(HclParser.LiteralTermContext ctx) {
        return visit(ctx.literalValue());
    }

    @Override
    public Optional<ConfigValue> visitLiteralValue(HclParser.LiteralValueContext ctx) {
        if (ctx.NUMBER() != null) {
            return Optional.of(ConfigValue.of(Double.parseDouble(ctx.NUMBER().getText())));
        }
        if (ctx.TRUE() != null) {
            return Optional.of(ConfigValue.of(true));
        }
        if (ctx.FALSE() != null) {
            return Optional.of(ConfigValue.of(false));
        }
        return Optional.of(ConfigValue.nullValue());
    }

    @Override
    public Optional<ConfigValue> visitTemplateTerm(HclParser.TemplateTermContext ctx) {
        return visit(ctx.templateExpr());
    }

    @Override
    public Optional<ConfigValue> visitTemplateExpr(HclParser.TemplateExprContext ctx) {
        if (ctx.STRING() != null) {
            return stringLiteral(ctx.STRING()).map(ConfigValue::of);
        }
        return heredocLiteral(ctx.HEREDOC().getText()).map(ConfigValue::of);
    }

    @Override
    public Optional<ConfigValue> visitTupleTerm(HclParser.TupleTermContext ctx) {
        return visit(ctx.tuple());
    }

    @Override
    public Optional<ConfigValue> visitTuple(HclParser.TupleContext ctx) {
        List<ConfigValue> elements = new ArrayList<>();
        for (HclParser.ExpressionContext element : ctx.expression()) {
            Optional<ConfigValue> value = visit(element);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            elements.add(value.get());
        }
        return Optional.of(new ListValue(elements));
    }

    @Override
    public Optional<ConfigValue> visitObjectTerm(HclParser.ObjectTermContext ctx) {
        return visit(ctx.object());
    }

    @Override
    public Optional<ConfigValue> visitObject(HclParser.ObjectContext ctx) {
        Map<String, ConfigValue> entries = new LinkedHashMap<>();
        for (HclParser.ObjectElemContext element : ctx.objectElem()) {
            Optional<String> key = objectKey(element.objectKey());
            Optional<ConfigValue> value = visit(element.expression());
            if (key.isEmpty() || value.isEmpty()) {
                return Optional.empty();
            }
            entries.put(key.get(), value.get());
        }
        return Optional.of(new MapValue(entries));
    }

    /**
     * Returns the text of a bare-name or literal-string object key.
     */
    private Optional<String> objectKey(HclParser.ObjectKeyContext ctx) {
        if (ctx.name() != null) {
            return Optional.of(ctx.name().getText());
        }
        HclParser.ExpressionContext expression = ctx.expression();
        if (expression instanceof HclParser.TermExpressionContext term
            && term.exprTerm() instanceof HclParser.VariableTermContext variable) {
            return Optional.of(variable.IDENTIFIER().getText());
        }
        return visit(expression)
            .filter(ConfigValue.StringValue.class::isInstance)
            .map(value -> ((ConfigValue.StringValue) value).value());
    }

    /**
     * Decodes a quoted string token, or returns empty if it holds a template sequence.
     *
     * @param token STRING token including its quotes
     * @return decoded text
     */
    static Optional<String> stringLiteral(TerminalNode token) {
        String text = token.getText();
        return decodeTemplate(text.substring(1, text.length() - 1), true);
    }

    /**
     * Decodes a heredoc token, or returns empty if it holds a template sequence.
     *
     * <p>Each content line keeps its trailing newline. The indented form {@code <<-} removes the
     * smallest leading whitespace shared by all non-blank lines.
     *
     * @param text full heredoc token text, from {@code <<} through the closing marker line
     * @return decoded text
     */
    static Optional<String> heredocLiteral(String text) {
        boolean indented = text.startsWith("<<-");
        int headerEnd = text.indexOf('\n');
        String marker = text.substring(indented ? 3 : 2, headerEnd).strip();

        List<String> lines = new ArrayList<>();
        for (String line : text.substring(headerEnd + 1).split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).strip().equals(marker)) {
            lines.remove(lines.size() - 1);
        }

        int indent = indented ? commonIndent(lines) : 0;
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line.length() >= indent ? line.substring(indent) : line.strip()).append('\n');
        }
        return decodeTemplate(content.toString(), false);
    }

    private static int commonIndent(List<String> lines) {
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int leading = 0;
            while (leading < line.length() && (line.charAt(leading) == ' ' || line.charAt(leading) == '\t')) {
                leading++;
            }
            indent = Math.min(indent, leading);
        }
        return indent == Integer.MAX_VALUE ? 0 : indent;
    }

    private static Optional<String> decodeTemplate(String raw, boolean escapes) {
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            char next = i + 1 < raw.length() ? raw.charAt(i + 1) : 0;
            char afterNext = i + 2 < raw.length() ? raw.charAt(i + 2) : 0;

            if ((c == '$' || c == '%') && next == c && afterNext == '{') {
                out.append(c).append('{');
                i += 3;
            } else if ((c == '$' || c == '%') && next == '{') {
                return Optional.empty();
            } else if (escapes && c == '\\' && i + 1 < raw.length()) {
                i = appendEscape(raw, i + 1, out);
            } else {
                out.append(c);
                i++;
            }
        }
        return Optional.of(out.toString());
    }

    /**
     * Appends the character for the escape starting at {@code index} (just after the backslash).
     *
     * @return index of the first character after the escape
     */
    private static int appendEscape(String raw, int index, StringBuilder out) {
        char escape = raw.charAt(index);
        switch (escape) {
            case 'n' -> out.append('\n');
            case 'r' -> out.append('\r');
            case 't' -> out.append('\t');
            case 'u', 'U' -> {
                int digits = escape == 'u' ? 4 : 8;
                if (isHex(raw, index + 1, digits)) {
                    out.appendCodePoint(Integer.parseInt(raw.substring(index + 1, index + 1 + digits), 16));
                    return index + 1 + digits;
                }
                out.append(escape);
            }
            default -> out.append(escape);
        }
        return index + 1;
    }

    private static boolean isHex(String raw, int start, int count) {
        if (start + count > raw.length()) {
            return false;
        }
        for (int i = start; i < start + count; i++) {
            if (Character.digit(raw.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
