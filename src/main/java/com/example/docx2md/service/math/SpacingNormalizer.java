package com.example.docx2md.service.math;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Cosmetic clean-up of emitted LaTeX. Never changes rendered meaning and is idempotent:
 * the passes are repeated until the string stops changing.
 */
@Component
public class SpacingNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_COMMA = Pattern.compile("(\\s*,)+\\s*$");
    private static final Pattern COMMAND_ONLY = Pattern.compile("\\\\[a-zA-Z]+");

    public String normalize(String latex) {
        if (latex == null || latex.isEmpty()) {
            return "";
        }
        // Terminates: brace collapse only deletes and spacing only fills gaps it has not filled yet
        String current = latex;
        String next = collapseWhitespace(collapseBraces(insertCommandSpacing(current)));
        while (!next.equals(current)) {
            current = next;
            next = collapseWhitespace(collapseBraces(insertCommandSpacing(current)));
        }
        return current;
    }

    /**
     * Separates a command name from a following letter or digit, e.g. {@code \geqx} becomes
     * {@code \geq x}. A letter run that is not a known command is split after its longest
     * known prefix; unknown commands without such a prefix are left alone.
     */
    String insertCommandSpacing(String latex) {
        StringBuilder out = new StringBuilder(latex.length() + 8);
        int i = 0;
        int n = latex.length();
        while (i < n) {
            char c = latex.charAt(i);
            if (c != '\\' || i + 1 >= n) {
                out.append(c);
                i++;
                continue;
            }
            if (!isAsciiLetter(latex.charAt(i + 1))) {
                // control symbol: \\ \{ \, ...
                out.append(c).append(latex.charAt(i + 1));
                i += 2;
                continue;
            }
            int end = i + 1;
            while (end < n && isAsciiLetter(latex.charAt(end))) {
                end++;
            }
            String name = latex.substring(i + 1, end);
            if (SymbolTable.isKnownCommand(name)) {
                out.append('\\').append(name);
                if (end < n && Character.isLetterOrDigit(latex.charAt(end))) {
                    out.append(' ');
                }
                i = end;
                continue;
            }
            String prefix = longestKnownPrefix(name);
            if (prefix != null) {
                out.append('\\').append(prefix).append(' ');
                i = i + 1 + prefix.length();
            } else {
                out.append('\\').append(name);
                i = end;
            }
        }
        return out.toString();
    }

    /**
     * Drops redundant grouping: {@code {{x}}} becomes {@code {x}} and a stand-alone group
     * holding one ordinary token in front of a script, {@code {x}^{2}}, becomes
     * {@code x^{2}}. Groups that are command arguments are kept.
     */
    String collapseBraces(String latex) {
        StringBuilder sb = new StringBuilder(latex);
        int i = 0;
        while (i < sb.length()) {
            if (sb.charAt(i) != '{' || isEscaped(sb, i)) {
                i++;
                continue;
            }
            int close = matchingBrace(sb, i);
            if (close < 0) {
                i++;
                continue;
            }
            String content = sb.substring(i + 1, close);

            // {{T}} -> {T}
            if (content.length() > 2 && content.charAt(0) == '{'
                    && matchingBrace(sb, i + 1) == close - 1) {
                String inner = content.substring(1, content.length() - 1);
                if (isAtomic(inner)) {
                    sb.delete(close - 1, close);
                    sb.delete(i + 1, i + 2);
                    continue;
                }
            }

            // {x}^{2} -> x^{2}
            if (close + 1 < sb.length() && (sb.charAt(close + 1) == '^' || sb.charAt(close + 1) == '_')
                    && isOrdinaryToken(content) && isStandaloneGroup(sb, i, content)) {
                sb.delete(close, close + 1);
                sb.delete(i, i + 1);
                continue;
            }
            i++;
        }
        return sb.toString();
    }

    String collapseWhitespace(String latex) {
        String result = WHITESPACE.matcher(latex).replaceAll(" ").trim();
        return TRAILING_COMMA.matcher(result).replaceAll("");
    }

    private String longestKnownPrefix(String name) {
        for (int len = name.length() - 1; len > 0; len--) {
            String prefix = name.substring(0, len);
            if (SymbolTable.isKnownCommand(prefix)) {
                return prefix;
            }
        }
        return null;
    }

    private boolean isAtomic(String content) {
        if (content.length() == 1) {
            char c = content.charAt(0);
            return c != '{' && c != '}' && c != '\\' && !Character.isWhitespace(c);
        }
        if (content.length() == 2 && content.charAt(0) == '\\') {
            return !isAsciiLetter(content.charAt(1)) && !Character.isWhitespace(content.charAt(1));
        }
        return COMMAND_ONLY.matcher(content).matches();
    }

    private boolean isOrdinaryToken(String content) {
        if (content.length() == 1) {
            return isAsciiLetter(content.charAt(0)) || Character.isDigit(content.charAt(0));
        }
        return COMMAND_ONLY.matcher(content).matches() && SymbolTable.isOrdinarySymbol(content.substring(1));
    }

    // A group is stand-alone unless it is an argument of a command, a script or another group
    private boolean isStandaloneGroup(CharSequence sb, int open, String content) {
        int p = open - 1;
        while (p >= 0 && sb.charAt(p) == ' ') {
            p--;
        }
        if (p < 0) {
            return true;
        }
        char prev = sb.charAt(p);
        if (prev == '}' || prev == ']' || prev == '^' || prev == '_') {
            return false;
        }
        if (prev == '\\' || isEscaped(sb, p)) {
            return false;
        }
        if (isAsciiLetter(prev)) {
            int q = p;
            while (q >= 0 && isAsciiLetter(sb.charAt(q))) {
                q--;
            }
            if (q >= 0 && sb.charAt(q) == '\\' && !isEscaped(sb, q)) {
                return false;
            }
            // unwrapping a letter next to letters is fine, but a command must not swallow it
            return true;
        }
        if (Character.isDigit(content.charAt(0)) && (Character.isDigit(prev) || prev == '.')) {
            return false;
        }
        return open - 1 == p;
    }

    private int matchingBrace(CharSequence sb, int open) {
        int depth = 0;
        for (int i = open; i < sb.length(); i++) {
            char c = sb.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private boolean isEscaped(CharSequence sb, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && sb.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
