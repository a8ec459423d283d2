package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns template text into {@link TemplatePart}s in two passes: the text is cut into
 * literal spans and {@code {{ }}}, {@code {% %}} and {@code {# #}} tags, then the tags
 * are nested into {@code if}/{@code for} blocks.
 *
 * <p>A {@code -} just inside a tag strips the whitespace on that side of it, as in
 * {@code {%- if x -%}}.</p>
 */
final class TemplateParser {

    private static final int MAX_DEPTH = 50;

    private static final Pattern FOR_HEAD =
            Pattern.compile("([A-Za-z_]\\w*)(?:\\s*,\\s*([A-Za-z_]\\w*))?\\s+in\\s+(.+)", Pattern.DOTALL);

    private static final Set<String> RESERVED_TARGETS = Set.of(
            "loop", "conv", "var", "sys", "node", "nodes",
            "True", "False", "None", "true", "false", "null");

    private interface Segment {
    }

    private record Literal(String text) implements Segment {
    }

    private record Output(String source, int position) implements Segment {
    }

    private record Tag(String keyword, String argument, int position) implements Segment {
    }

    private final String template;
    private List<Segment> segments;
    private int index;
    private int depth;

    TemplateParser(String template) {
        this.template = template;
    }

    List<TemplatePart> parse() {
        segments = scan();
        List<TemplatePart> parts = block(Set.of());
        if (index < segments.size()) {
            Tag stray = (Tag) segments.get(index);
            throw error("Unexpected '{% " + stray.keyword() + " %}'", stray.position());
        }
        return parts;
    }

    // ── Pass 1: tags ─────────────────────────────────────────────────────────

    private List<Segment> scan() {
        List<Segment> out = new ArrayList<>();
        int cursor = 0;
        boolean trimNext = false;
        while (cursor < template.length()) {
            int open = nextOpener(cursor);
            String text = open < 0 ? template.substring(cursor) : template.substring(cursor, open);
            if (trimNext) text = text.stripLeading();
            if (open < 0) {
                addLiteral(out, text);
                break;
            }

            char kind = template.charAt(open + 1);
            int contentStart = open + 2;
            if (contentStart < template.length() && template.charAt(contentStart) == '-') {
                text = text.stripTrailing();
                contentStart++;
            }
            addLiteral(out, text);

            String closer = kind == '{' ? "}}" : kind + "}";
            int close = template.indexOf(closer, contentStart);
            if (close < 0) {
                throw error(kind == '{' ? "Unclosed placeholder" : kind == '%' ? "Unclosed statement" : "Unclosed comment",
                        open);
            }
            int contentEnd = close;
            trimNext = contentEnd > contentStart && template.charAt(contentEnd - 1) == '-';
            if (trimNext) contentEnd--;
            String content = template.substring(contentStart, contentEnd).trim();

            if (kind == '{') {
                if (content.isEmpty()) throw error("Empty placeholder", open);
                out.add(new Output(content, open));
            } else if (kind == '%') {
                if (content.isEmpty()) throw error("Empty statement", open);
                int space = indexOfWhitespace(content);
                String keyword = space < 0 ? content : content.substring(0, space);
                String argument = space < 0 ? "" : content.substring(space).trim();
                out.add(new Tag(keyword, argument, open));
            }
            cursor = close + closer.length();
        }
        return out;
    }

    private int nextOpener(int from) {
        int best = -1;
        for (String opener : new String[]{"{{", "{%", "{#"}) {
            int at = template.indexOf(opener, from);
            if (at >= 0 && (best < 0 || at < best)) best = at;
        }
        return best;
    }

    private static void addLiteral(List<Segment> out, String text) {
        if (!text.isEmpty()) out.add(new Literal(text));
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    // ── Pass 2: blocks ───────────────────────────────────────────────────────

    /** Parts up to the next tag whose keyword is in {@code terminators}, which is left unconsumed. */
    private List<TemplatePart> block(Set<String> terminators) {
        if (++depth > MAX_DEPTH) {
            throw error("Blocks are nested too deeply", 0);
        }
        try {
            List<TemplatePart> parts = new ArrayList<>();
            while (index < segments.size()) {
                Segment segment = segments.get(index);
                if (segment instanceof Literal literal) {
                    index++;
                    parts.add(new TemplatePart.Text(literal.text()));
                } else if (segment instanceof Output output) {
                    index++;
                    parts.add(new TemplatePart.Placeholder(output.source(), expression(output.source())));
                } else {
                    Tag tag = (Tag) segment;
                    if (terminators.contains(tag.keyword())) {
                        return parts;
                    }
                    index++;
                    switch (tag.keyword()) {
                        case "if" -> parts.add(conditional(tag));
                        case "for" -> parts.add(loop(tag));
                        case "elif", "else", "endif", "endfor" ->
                                throw error("Unexpected '{% " + tag.keyword() + " %}'", tag.position());
                        default -> throw error("Unsupported statement '" + tag.keyword() + "'", tag.position());
                    }
                }
            }
            return parts;
        } finally {
            depth--;
        }
    }

    private TemplatePart conditional(Tag opening) {
        List<TemplatePart.Branch> branches = new ArrayList<>();
        Tag current = opening;
        while (true) {
            Expression condition = condition(current);
            branches.add(new TemplatePart.Branch(condition, block(Set.of("elif", "else", "endif"))));
            Tag next = closing(opening, "endif");
            switch (next.keyword()) {
                case "elif" -> current = next;
                case "else" -> {
                    List<TemplatePart> otherwise = block(Set.of("endif"));
                    expectEnd(opening, "endif");
                    return new TemplatePart.Conditional(branches, otherwise);
                }
                default -> {
                    return new TemplatePart.Conditional(branches, List.of());
                }
            }
        }
    }

    private TemplatePart loop(Tag opening) {
        Matcher head = FOR_HEAD.matcher(opening.argument());
        if (!head.matches()) {
            throw error("Expected '{% for name in expression %}'", opening.position());
        }
        List<String> targets = new ArrayList<>();
        targets.add(target(head.group(1), opening));
        if (head.group(2) != null) {
            targets.add(target(head.group(2), opening));
        }
        Expression iterable = expression(head.group(3).trim());

        List<TemplatePart> body = block(Set.of("else", "endfor"));
        Tag next = closing(opening, "endfor");
        List<TemplatePart> otherwise = List.of();
        if (next.keyword().equals("else")) {
            otherwise = block(Set.of("endfor"));
            expectEnd(opening, "endfor");
        }
        return new TemplatePart.Loop(targets, iterable, body, otherwise);
    }

    private Expression condition(Tag tag) {
        if (tag.argument().isEmpty()) {
            throw error("'{% " + tag.keyword() + " %}' needs a condition", tag.position());
        }
        return expression(tag.argument());
    }

    private String target(String name, Tag tag) {
        if (RESERVED_TARGETS.contains(name) || name.startsWith("_")) {
            throw error("'" + name + "' cannot be used as a loop variable", tag.position());
        }
        return name;
    }

    /** Consumes the tag that ended a block body. */
    private Tag closing(Tag opening, String end) {
        if (index >= segments.size()) {
            throw error("'{% " + opening.keyword() + " %}' is never closed with '{% " + end + " %}'",
                    opening.position());
        }
        return (Tag) segments.get(index++);
    }

    private void expectEnd(Tag opening, String end) {
        Tag next = closing(opening, end);
        if (!next.keyword().equals(end)) {
            throw error("Expected '{% " + end + " %}'", next.position());
        }
    }

    private static Expression expression(String source) {
        return new ExpressionParser(source).parse();
    }

    private InvalidExpressionException error(String message, int position) {
        return new InvalidExpressionException(message, template, position);
    }
}
