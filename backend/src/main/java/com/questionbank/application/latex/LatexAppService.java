package com.questionbank.application.latex;

import com.questionbank.domain.latex.model.LatexStats;
import com.questionbank.domain.latex.model.LatexValidationResult;
import com.questionbank.domain.latex.model.RepairResult;
import com.questionbank.infrastructure.latex.pipeline.LatexRepairPipeline;
import com.questionbank.infrastructure.latex.preprocessing.DelimiterNormalizer;
import com.questionbank.infrastructure.latex.validation.LatexValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class LatexAppService {

    private final LatexRepairPipeline latexRepairPipeline;
    private final DelimiterNormalizer delimiterNormalizer;
    private final LatexValidator latexValidator;

    @Value("${latex.api.max-text-length:100000}")
    private int maxTextLength;

    /**
     * Full delimiter repair (normalize → protect → wrap → merge → cleanup).
     */
    public RepairResult quickFix(String text, String userId) {
        checkLength(text);
        RepairResult result = latexRepairPipeline.execute(text);
        log.info("[LatexAppService] quick-fix user={} chars={} spans={} mergePasses={}",
                userId, text.length(), result.protectedSpanCount(), result.mergePasses());
        return result;
    }

    /**
     * Delimiter normalization only: {@code \( \)}, {@code \[ \]} and bare environments.
     */
    public String normalize(String text, String userId) {
        checkLength(text);
        String result = delimiterNormalizer.normalize(text);
        log.info("[LatexAppService] normalize user={} chars={} changed={}",
                userId, text.length(), !result.equals(text));
        return result;
    }

    public LatexValidationResult validate(String text) {
        checkLength(text);
        return latexValidator.validate(text);
    }

    public LatexStats stats(String text) {
        checkLength(text);
        return latexValidator.stats(text);
    }

    private void checkLength(String text) {
        if (text.length() > maxTextLength) {
            throw new IllegalArgumentException(
                    String.format("Text must not exceed %d characters", maxTextLength));
        }
    }
}
