package com.questionbank.infrastructure.latex.preprocessing;

import com.questionbank.domain.latex.model.ProtectedSpanKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpanRestorerTest {

    private SpanRestorer restorer;
    private MathSpanProtector protector;
    private SpanTable spans;

    @BeforeEach
    void setUp() {
        restorer = new SpanRestorer();
        protector = new MathSpanProtector();
        spans = new SpanTable();
    }

    @Test
    @DisplayName("restoreAll gives back the exact input")
    void round_trip() {
        String input = "Let $x$ be \\$5 and $$y = x\n+ 1$$ done";
        String masked = protector.protectExisting(protector.shieldLiterals(input, spans), spans);

        assertThat(masked).doesNotContain("$");
        assertThat(restorer.restoreAll(masked, spans)).isEqualTo(input);
    }

    @Test
    @DisplayName("restoreInline leaves display spans masked")
    void inline_only() {
        String masked = protector.protectExisting("$x$ and $$y$$", spans);

        String restored = restorer.restoreInline(masked, spans);

        assertThat(restored).startsWith("$x$ and ").doesNotContain("$$y$$");
        assertThat(restorer.restoreAll(restored, spans)).isEqualTo("$x$ and $$y$$");
    }

    @Test
    @DisplayName("literal inside display math is restored after the display span")
    void literal_inside_display() {
        String input = "$$a \\$ b$$";
        String masked = protector.protectExisting(protector.shieldLiterals(input, spans), spans);

        assertThat(restorer.restoreAll(masked, spans)).isEqualTo(input);
    }

    @Test
    @DisplayName("unknown placeholder is left in place")
    void unknown_placeholder() {
        String orphan = SpanTable.placeholderFor(ProtectedSpanKind.INLINE_MATH, 5);
        String text = "a " + orphan;

        assertThat(restorer.restoreAll(text, spans)).isEqualTo(text);
    }
}
