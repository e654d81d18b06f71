package com.scholary.audiobook.enhancer.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.audiobook.enhancer.cache.InMemorySpokenMathCache;
import com.scholary.audiobook.enhancer.document.MathExpression;
import com.scholary.audiobook.enhancer.document.MathExpressionExtractor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MathSpanProcessorTest {

  @Mock private MathTransducer transducer;

  private InMemorySpokenMathCache cache;
  private MathSpanProcessor processor;

  @BeforeEach
  void setUp() {
    cache = new InMemorySpokenMathCache(100);
    processor =
        new MathSpanProcessor(
            transducer, new RegexMathTransducer(), cache, new MathExpressionExtractor());
    lenient().when(transducer.getBackendName()).thenReturn("mock");
  }

  @Test
  void process_shouldWrapInlineAndBlockMath() {
    when(transducer.toSpeech("x", false)).thenReturn("x");
    when(transducer.toSpeech("y", true)).thenReturn("y");

    String result = processor.process("Let $x$ be\n$$ y $$\ndone");

    assertThat(result).isEqualTo("Let [MATH] x [/MATH] be\n[MATH_BLOCK] y [/MATH_BLOCK]\ndone");
  }

  @Test
  void process_shouldKeepLaterSpansAlignedWhenLengthsDiffer() {
    when(transducer.toSpeech("a", false)).thenReturn("a very long spoken form");
    when(transducer.toSpeech("b", false)).thenReturn("b");

    String result = processor.process("$a$ and $b$.");

    assertThat(result).isEqualTo("[MATH] a very long spoken form [/MATH] and [MATH] b [/MATH].");
  }

  @Test
  void process_shouldFallBackToRegexWhenBackendFails() {
    when(transducer.toSpeech(anyString(), anyBoolean()))
        .thenThrow(new IllegalStateException("backend down"));

    String result = processor.process("Value $\\infty$ here");

    assertThat(result).isEqualTo("Value [MATH] infinity [/MATH] here");
  }

  @Test
  void process_shouldConvertRepeatedExpressionOnce() {
    when(transducer.toSpeech("x", false)).thenReturn("x");

    processor.process("$x$ plus $x$ plus $x$");

    verify(transducer, times(1)).toSpeech("x", false);
  }

  @Test
  void process_shouldSkipAnchorThatDoesNotMatchText() {
    String text = "no math here at all";

    String result = processor.process(text, List.of(new MathExpression("x", false, 3, 6)));

    assertThat(result).isEqualTo(text);
  }

  @Test
  void process_shouldReturnTextWithoutMathUnchanged() {
    assertThat(processor.process("Plain prose.")).isEqualTo("Plain prose.");
  }
}
