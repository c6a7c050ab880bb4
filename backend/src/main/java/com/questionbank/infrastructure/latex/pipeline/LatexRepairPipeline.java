package com.questionbank.infrastructure.latex.pipeline;

import com.questionbank.domain.latex.model.RepairResult;
import com.questionbank.infrastructure.latex.cleanup.DelimiterCleanup;
import com.questionbank.infrastructure.latex.merging.AdjacentSpanMerger;
import com.questionbank.infrastructure.latex.merging.AdjacentSpanMerger.MergeResult;
import com.questionbank.infrastructure.latex.preprocessing.DelimiterNormalizer;
import com.questionbank.infrastructure.latex.preprocessing.MathSpanProtector;
import com.questionbank.infrastructure.latex.preprocessing.SpanRestorer;
import com.questionbank.infrastructure.latex.preprocessing.SpanTable;
import com.questionbank.infrastructure.latex.wrapping.BareMathWrapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orchestrates the delimiter repair of one text:
 * <p>
 * shield literals → normalize → protect existing math → wrap bare math →
 * restore inline → fix nested degrees → merge → cleanup → restore display and literals
 * </p>
 * Every call owns its span table; the bean itself holds no state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LatexRepairPipeline {

    private final DelimiterNormalizer delimiterNormalizer;
    private final MathSpanProtector spanProtector;
    private final BareMathWrapper bareMathWrapper;
    private final SpanRestorer spanRestorer;
    private final AdjacentSpanMerger spanMerger;
    private final DelimiterCleanup delimiterCleanup;

    /**
     * Repair the math delimiters of {@code text}. Deterministic and idempotent;
     * {@code null} and empty input come back unchanged.
     */
    public String repair(String text) {
        return execute(text).text();
    }

    public RepairResult execute(String text) {
        if (text == null || text.isEmpty()) {
            return new RepairResult(text, 0, 0);
        }

        SpanTable spans = new SpanTable();

        // 1. Escaped dollars and placeholder-range characters out of the way
        String masked = spanProtector.shieldLiterals(text, spans);

        // 2. \( \) \[ \] and bare environments → dollar form
        masked = delimiterNormalizer.normalize(masked);

        // 3. Existing math is frozen
        masked = spanProtector.protectExisting(masked, spans);

        // 4. Rule cascade over the bare text
        masked = bareMathWrapper.wrap(masked, spans);

        // 5. Inline spans back for merging; display and literals stay masked
        String restored = spanRestorer.restoreInline(masked, spans);

        // 6. Degrees split by the command rule become one span again
        restored = delimiterCleanup.fixNestedDegrees(restored);

        // 7. Merge to a fixed point
        MergeResult merged = spanMerger.merge(restored);

        // 8. Cleanup
        String cleaned = delimiterCleanup.clean(merged.text());

        // 9. Everything else back
        String result = spanRestorer.restoreAll(cleaned, spans);

        log.debug("LaTeX repair: {} chars → {} chars, spans={}, mergePasses={}",
                text.length(), result.length(), spans.size(), merged.passes());

        return new RepairResult(result, merged.passes(), spans.size());
    }
}
