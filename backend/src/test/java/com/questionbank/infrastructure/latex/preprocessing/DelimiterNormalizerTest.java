package com.questionbank.infrastructure.latex.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelimiterNormalizerTest {

    private DelimiterNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DelimiterNormalizer();
    }

    @Test
    @DisplayName("null and empty input")
    void null_and_empty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("\\( \\) becomes inline dollars")
    void inline_parens() {
        assertThat(normalizer.normalize("\\(x+y\\)")).isEqualTo("$x+y$");
    }

    @Test
    @DisplayName("blanks just inside \\( \\) are dropped")
    void inline_parens_trimmed() {
        assertThat(normalizer.normalize("so \\( x + y \\) holds")).isEqualTo("so $x + y$ holds");
    }

    @Test
    @DisplayName("\\( \\) spanning lines is left alone")
    void inline_parens_multiline() {
        String input = "\\(a\nb\\)";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("\\[ \\] becomes display dollars")
    void display_brackets() {
        assertThat(normalizer.normalize("\\[a+b\\]")).isEqualTo("$$a+b$$");
        assertThat(normalizer.normalize("\\[\na+b\n\\]")).isEqualTo("$$\na+b\n$$");
    }

    @Test
    @DisplayName("a \\\\[2pt] line break is not a delimiter")
    void line_break_with_spacing() {
        String input = "first \\\\[2pt] second \\\\] third";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("bare whitelisted environment is wrapped in $$")
    void bare_environment() {
        assertThat(normalizer.normalize("\\begin{align}x&=1\\end{align}"))
                .isEqualTo("$$\\begin{align}x&=1\\end{align}$$");
        assertThat(normalizer.normalize("\\begin{align*}x&=1\\end{align*}"))
                .isEqualTo("$$\\begin{align*}x&=1\\end{align*}$$");
    }

    @Test
    @DisplayName("environment already inside delimiters is unchanged")
    void wrapped_environment() {
        String display = "$$\\begin{equation}E=mc^2\\end{equation}$$";
        String inline = "$\\begin{aligned}a\\end{aligned}$";
        assertThat(normalizer.normalize(display)).isEqualTo(display);
        assertThat(normalizer.normalize(inline)).isEqualTo(inline);
    }

    @Test
    @DisplayName("environment right after a line break backslash is not wrapped")
    void environment_after_line_break() {
        String input = "\\\\\\begin{align}p\\end{align}";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("brackets holding a dollar are left for the protector")
    void brackets_around_dollar() {
        assertThat(normalizer.normalize("\\(a $ b\\)")).isEqualTo("\\(a $ b\\)");
        assertThat(normalizer.normalize("\\[a $ b\\]")).isEqualTo("\\[a $ b\\]");
        assertThat(normalizer.normalize("\\(\\(z\\)\\)")).isEqualTo("$\\(z$\\)");
    }

    @Test
    @DisplayName("environment outside the whitelist is unchanged")
    void unknown_environment() {
        String input = "\\begin{pmatrix}a\\end{pmatrix}";
        assertThat(normalizer.normalize(input)).isEqualTo(input);
    }

    @Test
    @DisplayName("idempotent")
    void idempotent() {
        String input = "Let \\(a\\) be \\[a^2\\] and \\begin{gather}b\\end{gather} done";
        String once = normalizer.normalize(input);
        assertThat(once).isEqualTo("Let $a$ be $$a^2$$ and $$\\begin{gather}b\\end{gather}$$ done");
        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }
}
