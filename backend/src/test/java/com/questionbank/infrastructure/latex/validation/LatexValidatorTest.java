package com.questionbank.infrastructure.latex.validation;

import com.questionbank.domain.latex.model.LatexIssue;
import com.questionbank.domain.latex.model.LatexIssueType;
import com.questionbank.domain.latex.model.LatexStats;
import com.questionbank.domain.latex.model.LatexValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LatexValidatorTest {

    private LatexValidator validator;

    @BeforeEach
    void setUp() {
        validator = new LatexValidator();
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("well-formed text has no issues")
        void valid() {
            LatexValidationResult result = validator.validate("$x$ and $$\\frac{a}{b}$$");

            assertThat(result.valid()).isTrue();
            assertThat(result.issues()).isEmpty();
        }

        @Test
        @DisplayName("odd number of dollars")
        void unmatched_dollar() {
            LatexValidationResult result = validator.validate("$x");

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).extracting(LatexIssue::type)
                    .containsExactly(LatexIssueType.UNMATCHED_DOLLAR);
        }

        @Test
        @DisplayName("escaped dollars do not count")
        void escaped_dollar() {
            assertThat(validator.validate("\\$5 and $x$").valid()).isTrue();
            assertThat(validator.validate("\\\\$x$").valid()).isTrue();
        }

        @Test
        @DisplayName("unbalanced braces, escaped braces ignored")
        void braces() {
            assertThat(validator.validate("$\\frac{a}{b$").errors()).extracting(LatexIssue::type)
                    .containsExactly(LatexIssueType.UNBALANCED_BRACES);
            assertThat(validator.validate("$x}{$").valid()).isFalse();
            assertThat(validator.validate("set \\{a\\} $x$").valid()).isTrue();
        }

        @Test
        @DisplayName("commands without any delimiter raise a warning only")
        void undelimited_commands() {
            LatexValidationResult result = validator.validate("\\alpha + \\beta");

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.warnings()).extracting(LatexIssue::type)
                    .containsExactly(LatexIssueType.UNDELIMITED_COMMANDS);
        }

        @Test
        @DisplayName("empty input is valid")
        void empty() {
            assertThat(validator.validate("").valid()).isTrue();
            assertThat(validator.validate(null).issues()).isEmpty();
        }
    }

    @Nested
    @DisplayName("stats")
    class Stats {

        @Test
        @DisplayName("counts inline, display and commands")
        void counts() {
            LatexStats stats = validator.stats("Let $x$ and $$y$$ with \\(z\\) and $\\alpha$");

            assertThat(stats.inlineMathCount()).isEqualTo(3);
            assertThat(stats.displayMathCount()).isEqualTo(1);
            assertThat(stats.commandCount()).isEqualTo(1);
            assertThat(stats.totalDelimiters()).isEqualTo(4);
            assertThat(stats.hasIssues()).isFalse();
        }

        @Test
        @DisplayName("total counts delimited spans, not dollar signs")
        void total_counts_spans() {
            assertThat(validator.stats("$x$").totalDelimiters()).isEqualTo(1);
            assertThat(validator.stats("\\(x\\)").totalDelimiters()).isEqualTo(1);
            assertThat(validator.stats("\\(x\\)").inlineMathCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("warnings count as issues")
        void issues() {
            assertThat(validator.stats("\\alpha").hasIssues()).isTrue();
        }

        @Test
        @DisplayName("empty input")
        void empty() {
            assertThat(validator.stats("")).isEqualTo(new LatexStats(0, 0, 0, 0, false));
        }
    }
}
