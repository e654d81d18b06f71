package com.scholary.audiobook.enhancer.rewrite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.enhancer.config.EnhancementProperties.OllamaProperties;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OllamaTextRewriterTest {

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private OllamaTextRewriter rewriter;

  @BeforeEach
  void setUp() {
    rewriter =
        new OllamaTextRewriter(
            new OllamaProperties(true, "http://ollama:11434", "llama2:7b", 5),
            new ObjectMapper(),
            httpClient);
  }

  @Test
  void rewrite_shouldReturnGeneratedText() throws Exception {
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"response\": \"Better text.\", \"done\": true}");
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    RewriteResult result = rewriter.rewrite("Original text.");

    assertThat(result.changed()).isTrue();
    assertThat(result.content()).isEqualTo("Better text.");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri().toString()).isEqualTo("http://ollama:11434/api/generate");
    assertThat(captor.getValue().method()).isEqualTo("POST");
  }

  @Test
  void rewrite_shouldKeepOriginalOnErrorStatus() throws Exception {
    when(response.statusCode()).thenReturn(500);
    when(response.body()).thenReturn("model not loaded");
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    RewriteResult result = rewriter.rewrite("Original text.");

    assertThat(result.changed()).isFalse();
    assertThat(result.content()).isEqualTo("Original text.");
  }

  @Test
  void rewrite_shouldKeepOriginalWhenServerUnreachable() throws Exception {
    doThrow(new IOException("Connection refused"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    RewriteResult result = rewriter.rewrite("Original text.");

    assertThat(result).isEqualTo(RewriteResult.unchanged("Original text."));
  }

  @Test
  void rewrite_shouldKeepOriginalWhenReplyHasNoText() throws Exception {
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"done\": true}");
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    assertThat(rewriter.rewrite("Original text.").changed()).isFalse();
  }

  @Test
  void rewrite_shouldTreatBlankReplyAsUnchanged() throws Exception {
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"response\": \"   \"}");
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    assertThat(rewriter.rewrite("Original text.").content()).isEqualTo("Original text.");
  }
}
