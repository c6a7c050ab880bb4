package com.questionbank.infrastructure.latex.wrapping;

import java.util.regex.Pattern;

/**
 * Token shapes and brace scanning shared by the wrap rules.
 */
final class LatexMarkup {

    /** A backslash command or the start of a braced sub/superscript. */
    static final Pattern MARKUP_TOKEN = Pattern.compile("\\\\[a-zA-Z]+|[_^]\\{");

    static final String TRIG_COMMANDS = "cos|sin|tan|cot|sec|csc";

    static final String DEGREE = "\\d+(?:\\.\\d+)?[ \\t]*\\^[ \\t]*\\{\\\\circ\\}";

    // Stray dollars and display placeholders cannot sit inside inline math
    private static final Pattern NOT_INLINE = Pattern.compile("[$\\x{E002}\\x{E003}]");

    private LatexMarkup() {
    }

    /**
     * Scan a command starting at the backslash at {@code start}: its letters, any
     * balanced {@code {..}} or {@code [..]} arguments, then braced scripts.
     *
     * @return end index (exclusive), or -1 if no command starts there
     */
    static int scanCommand(CharSequence s, int start) {
        if (start + 1 >= s.length() || s.charAt(start) != '\\' || !isAsciiLetter(s.charAt(start + 1))) {
            return -1;
        }
        int i = start + 1;
        while (i < s.length() && isAsciiLetter(s.charAt(i))) {
            i++;
        }
        while (i < s.length() && (s.charAt(i) == '{' || s.charAt(i) == '[')) {
            char open = s.charAt(i);
            int end = skipGroup(s, i, open, open == '{' ? '}' : ']');
            if (end < 0) {
                break;
            }
            i = end;
        }
        return scanScripts(s, i);
    }

    /**
     * Consume consecutive {@code _{..}} / {@code ^{..}} groups starting at {@code from}.
     *
     * @return index after the last complete script, {@code from} if there is none
     */
    static int scanScripts(CharSequence s, int from) {
        int i = from;
        while (i + 1 < s.length() && (s.charAt(i) == '_' || s.charAt(i) == '^') && s.charAt(i + 1) == '{') {
            int end = skipGroup(s, i + 1, '{', '}');
            if (end < 0) {
                break;
            }
            i = end;
        }
        return i;
    }

    /**
     * @return index just past the bracket closing the one at {@code open}, or -1 if unbalanced
     */
    static int skipGroup(CharSequence s, int open, char openCh, char closeCh) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            // inline math stays on one line
            if (c == '\n') {
                return -1;
            }
            if (c == '\\' && i + 1 < s.length()) {
                i++;
                continue;
            }
            if (c == openCh) {
                depth++;
            } else if (c == closeCh) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    /**
     * Whether a region of masked text may become one inline span. Enclosed inline
     * placeholders are fine: wrapping absorbs them.
     */
    static boolean canWrap(CharSequence region) {
        return !NOT_INLINE.matcher(region).find();
    }

    static int precedingBackslashes(CharSequence s, int index) {
        int run = 0;
        for (int i = index - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            run++;
        }
        return run;
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
