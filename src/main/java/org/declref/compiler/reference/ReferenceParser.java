package org.declref.compiler.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses declaration reference notation into a {@link DeclarationReference}.
 *
 * <p>Grammar: {@code [package[/import/path]#]member(.member)*}, where a member is either
 * {@code identifier[:selector]} or {@code [symbolKey][:selector]}. Scoped package names
 * ({@code @scope/name}) keep their first slash. The selector family is inferred from its
 * spelling: lower-case letters are system selectors, digits are indexes and upper-case
 * words are labels.</p>
 *
 * <p>The parser checks shape only; whether a member or selector exists is left to the resolver.</p>
 */
public final class ReferenceParser {

    // ECMAScript IdentifierName: Unicode letters, plus marks, digits and connectors after the first character.
    private static final Pattern IDENTIFIER =
            Pattern.compile("[\\p{L}\\p{Nl}_$][\\p{L}\\p{Nl}\\p{Mn}\\p{Mc}\\p{Nd}\\p{Pc}_$]*");
    private static final Pattern SYSTEM_SELECTOR = Pattern.compile("[a-z]+");
    private static final Pattern INDEX_SELECTOR = Pattern.compile("[0-9]+");
    private static final Pattern LABEL_SELECTOR = Pattern.compile("[A-Z][A-Z0-9_]*");

    private ReferenceParser() {
    }

    /**
     * Parses reference text.
     *
     * @param text The reference, e.g. {@code widgets#Shape:class}.
     * @return The structured reference. The member list is empty for {@code package#}.
     * @throws ReferenceSyntaxException if the text is malformed.
     */
    public static DeclarationReference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ReferenceSyntaxException("Empty reference", String.valueOf(text), 0);
        }
        String trimmed = text.strip();

        String packageName = null;
        String importPath = null;
        int memberStart = 0;

        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            String qualifier = trimmed.substring(0, hash);
            if (qualifier.isEmpty()) {
                throw new ReferenceSyntaxException("Missing package name before '#'", trimmed, 0);
            }
            int packageEnd = packageNameEnd(qualifier);
            packageName = qualifier.substring(0, packageEnd);
            if (packageEnd < qualifier.length()) {
                importPath = qualifier.substring(packageEnd + 1);
                if (importPath.isEmpty()) {
                    throw new ReferenceSyntaxException("Empty import path", trimmed, packageEnd);
                }
            }
            memberStart = hash + 1;
        }

        List<MemberReference> members = new ArrayList<>();
        if (memberStart < trimmed.length()) {
            parseMembers(trimmed, memberStart, members);
        }
        return new DeclarationReference(packageName, importPath, members);
    }

    private static int packageNameEnd(String qualifier) {
        int slash = qualifier.indexOf('/');
        if (qualifier.startsWith("@") && slash >= 0) {
            slash = qualifier.indexOf('/', slash + 1);
        }
        return slash < 0 ? qualifier.length() : slash;
    }

    private static void parseMembers(String text, int start, List<MemberReference> out) {
        int pos = start;
        while (true) {
            int memberEnd = findMemberEnd(text, pos);
            out.add(parseMember(text, pos, memberEnd));
            if (memberEnd >= text.length()) {
                return;
            }
            pos = memberEnd + 1;
            if (pos >= text.length()) {
                throw new ReferenceSyntaxException("Dangling '.'", text, memberEnd);
            }
        }
    }

    // Dots inside a [symbol key] do not separate members.
    private static int findMemberEnd(String text, int pos) {
        if (text.charAt(pos) == '[') {
            int close = text.indexOf(']', pos);
            if (close < 0) {
                throw new ReferenceSyntaxException("Unclosed '['", text, pos);
            }
            pos = close;
        }
        int dot = text.indexOf('.', pos);
        return dot < 0 ? text.length() : dot;
    }

    private static MemberReference parseMember(String text, int start, int end) {
        if (start == end) {
            throw new ReferenceSyntaxException("Empty member", text, start);
        }
        String member = text.substring(start, end);

        String identifier = null;
        String symbolKey = null;
        String selectorText = null;

        if (member.startsWith("[")) {
            int close = member.indexOf(']');
            symbolKey = member.substring(1, close);
            if (symbolKey.isEmpty()) {
                throw new ReferenceSyntaxException("Empty symbol key", text, start);
            }
            String rest = member.substring(close + 1);
            if (!rest.isEmpty()) {
                if (rest.charAt(0) != ':') {
                    throw new ReferenceSyntaxException("Unexpected text after symbol key", text, start + close + 1);
                }
                selectorText = rest.substring(1);
            }
        } else {
            int colon = member.indexOf(':');
            identifier = colon < 0 ? member : member.substring(0, colon);
            if (colon >= 0) {
                selectorText = member.substring(colon + 1);
            }
            if (!IDENTIFIER.matcher(identifier).matches()) {
                throw new ReferenceSyntaxException("Invalid identifier '" + identifier + "'", text, start);
            }
        }

        Selector selector = null;
        if (selectorText != null) {
            selector = parseSelector(selectorText, text, end - selectorText.length());
        }
        return new MemberReference(identifier, symbolKey, selector);
    }

    private static Selector parseSelector(String selectorText, String text, int column) {
        if (SYSTEM_SELECTOR.matcher(selectorText).matches()) {
            return new Selector(SelectorFamily.SYSTEM, selectorText);
        }
        if (INDEX_SELECTOR.matcher(selectorText).matches()) {
            return new Selector(SelectorFamily.INDEX, selectorText);
        }
        if (LABEL_SELECTOR.matcher(selectorText).matches()) {
            return new Selector(SelectorFamily.LABEL, selectorText);
        }
        throw new ReferenceSyntaxException("Invalid selector '" + selectorText + "'", text, column);
    }
}
