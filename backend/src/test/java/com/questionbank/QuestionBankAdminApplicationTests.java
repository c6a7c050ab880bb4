package com.questionbank;

import com.questionbank.infrastructure.latex.LatexRepairSettings;
import com.questionbank.infrastructure.latex.pipeline.LatexRepairPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class QuestionBankAdminApplicationTests {

    @Autowired
    private LatexRepairSettings settings;

    @Autowired
    private LatexRepairPipeline pipeline;

    @Test
    void contextLoads() {
        assertThat(settings.maxMergePasses()).isEqualTo(15);
        assertThat(settings.clauseKeywords()).containsExactlyElementsOf(LatexRepairSettings.DEFAULT_CLAUSE_KEYWORDS);
        assertThat(settings.sentenceOpeners()).containsExactlyElementsOf(LatexRepairSettings.DEFAULT_SENTENCE_OPENERS);
        assertThat(pipeline.repair("\\(x\\) = \\(y\\)")).isEqualTo("$x = y$");
    }
}
