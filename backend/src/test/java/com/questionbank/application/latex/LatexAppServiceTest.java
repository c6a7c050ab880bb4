package com.questionbank.application.latex;

import com.questionbank.infrastructure.latex.pipeline.LatexRepairPipeline;
import com.questionbank.infrastructure.latex.preprocessing.DelimiterNormalizer;
import com.questionbank.infrastructure.latex.validation.LatexValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LatexAppServiceTest {

    @Mock
    private LatexRepairPipeline latexRepairPipeline;

    private LatexAppService service;

    @BeforeEach
    void setUp() throws Exception {
        service = new LatexAppService(latexRepairPipeline, new DelimiterNormalizer(), new LatexValidator());
        setField("maxTextLength", 20);
    }

    private void setField(String name, int value) throws Exception {
        Field field = LatexAppService.class.getDeclaredField(name);
        field.setAccessible(true);
        field.set(service, value);
    }

    @Test
    @DisplayName("text over the configured limit is rejected before repair")
    void too_long() {
        assertThatThrownBy(() -> service.quickFix("x".repeat(21), "admin-1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Text must not exceed 20 characters");
        verify(latexRepairPipeline, never()).execute(anyString());
    }

    @Test
    @DisplayName("normalize runs the normalizer only")
    void normalize_only() {
        assertThat(service.normalize("\\(a\\) and b_{1}", "admin-1")).isEqualTo("$a$ and b_{1}");
        verify(latexRepairPipeline, never()).execute(anyString());
    }

    @Test
    @DisplayName("validate and stats use the validator")
    void validate_and_stats() {
        assertThat(service.validate("$x").valid()).isFalse();
        assertThat(service.stats("$x$").inlineMathCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("text at the limit is accepted, one more character is not")
    void length_boundary() {
        assertThat(service.normalize("x".repeat(20), "admin-1")).hasSize(20);
        assertThatThrownBy(() -> service.validate("x".repeat(21)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Text must not exceed 20 characters");
        assertThatThrownBy(() -> service.stats("x".repeat(21)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
