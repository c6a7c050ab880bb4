package com.questionbank.infrastructure.latex.merging;

import com.questionbank.infrastructure.latex.LatexRepairSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fuses neighbouring inline spans that belong to one expression, e.g.
 * {@code $a$ + $b$} becomes {@code $a + b$}.
 * <p>
 * Each pass walks the inline spans left to right and decides on the text
 * between two neighbours; a merged span keeps absorbing its right neighbours
 * within the same pass. Passes repeat until nothing changes or the cap is hit.
 * </p>
 */
@Slf4j
@Component
public class AdjacentSpanMerger {

    private static final Pattern INLINE_SPAN = Pattern.compile("\\$([^$\\n]+?)\\$");

    private static final Pattern TERMINATED = Pattern.compile("[.!?;][ \\t]*$");

    private static final Pattern OPERATOR = Pattern.compile("^[ \\t]*[-+=<>×·∙,][ \\t]*$");

    // Known false-merge risk: an article or variable between two spans also matches
    private static final Pattern LOWERCASE_LETTER = Pattern.compile("^[ \\t]*[a-z][ \\t]*$");

    private static final Pattern TRIG_COMMAND = Pattern.compile("^\\\\(?:cos|sin|tan|cot|sec|csc)$");

    private static final Pattern DEGREE = Pattern.compile("^\\d+(?:\\.\\d+)?[ \\t]*\\^[ \\t]*\\{\\\\circ\\}$");

    private static final Pattern BLANK = Pattern.compile("^[ \\t]*$");

    private static final Pattern SHORT_BLANK = Pattern.compile("^[ \\t]{1,2}$");

    private final int maxPasses;

    public AdjacentSpanMerger(LatexRepairSettings settings) {
        this.maxPasses = settings.maxMergePasses();
    }

    /**
     * Merge adjacent inline spans to a fixed point.
     *
     * @param text document with inline math restored, display math still masked
     * @return merged text and the number of passes run
     */
    public MergeResult merge(String text) {
        if (text == null || text.indexOf('$') < 0) {
            return new MergeResult(text, 0);
        }

        String current = text;
        int passes = 0;
        boolean changed = true;
        while (changed && passes < maxPasses) {
            passes++;
            String next = mergePass(current);
            changed = !next.equals(current);
            current = next;
        }

        if (changed) {
            log.warn("Span merging stopped at the {}-pass cap before reaching a fixed point", maxPasses);
        }
        return new MergeResult(current, passes);
    }

    String mergePass(String text) {
        Matcher matcher = INLINE_SPAN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int cursor = 0;
        int leftStart = -1;
        int leftEnd = -1;
        String leftBody = null;

        while (matcher.find()) {
            String rightBody = matcher.group(1);
            if (leftBody != null) {
                String gap = text.substring(leftEnd, matcher.start());
                Optional<String> joined = join(leftBody, gap, rightBody);
                if (joined.isPresent()) {
                    leftBody = joined.get();
                    leftEnd = matcher.end();
                    continue;
                }
                sb.append(text, cursor, leftStart).append('$').append(leftBody).append('$');
                cursor = leftEnd;
            }
            leftStart = matcher.start();
            leftEnd = matcher.end();
            leftBody = rightBody;
        }

        if (leftBody != null) {
            sb.append(text, cursor, leftStart).append('$').append(leftBody).append('$');
            cursor = leftEnd;
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }

    /**
     * Decide whether two neighbouring span bodies form one expression.
     *
     * @return the merged body, or empty to keep the spans apart
     */
    Optional<String> join(String left, String gap, String right) {
        // Inline math never crosses a line, which also covers "label:\n$x$"
        if (gap.indexOf('$') >= 0 || gap.indexOf('\n') >= 0) {
            return Optional.empty();
        }
        if (TERMINATED.matcher(gap).find()) {
            return Optional.empty();
        }
        if (OPERATOR.matcher(gap).matches() || LOWERCASE_LETTER.matcher(gap).matches()) {
            return Optional.of(left + gap + right);
        }
        if (TRIG_COMMAND.matcher(left).matches() && DEGREE.matcher(right).matches() && BLANK.matcher(gap).matches()) {
            return Optional.of(left + " " + right);
        }
        if (SHORT_BLANK.matcher(gap).matches() && left.indexOf('\\') >= 0 && right.indexOf('\\') >= 0) {
            return Optional.of(left + gap + right);
        }
        return Optional.empty();
    }

    /**
     * @param text   the merged document
     * @param passes merge passes run (0 when the text has no dollar at all)
     */
    public record MergeResult(String text, int passes) {}
}
