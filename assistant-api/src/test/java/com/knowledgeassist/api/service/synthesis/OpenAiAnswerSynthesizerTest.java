package com.knowledgeassist.api.service.synthesis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.model.RetrievedFragment;
import com.knowledgeassist.api.model.Source;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import com.knowledgeassist.api.service.synthesis.openai.OpenAiChatClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiAnswerSynthesizerTest {

    private static final List<RetrievedFragment> CONTEXT = List.of(
            new RetrievedFragment("d1", "handbook.md", "Employees receive 20 vacation days.", 0, 0.91),
            new RetrievedFragment("d2", "benefits.md", "Unused days carry over.", 2, 0.80)
    );

    @Mock
    private OpenAiChatClient chatClient;

    @Test
    void requestsJsonCompletionAndParsesAnswer() {
        when(chatClient.complete(any())).thenReturn(completion("""
                {"answer":"Employees receive 20 days.","sources":[{"document_name":"handbook.md","relevant_excerpt":"20 vacation days"}],"confidence":0.92,"insufficient_context":false}
                """));
        OpenAiAnswerSynthesizer synthesizer = synthesizer();

        SynthesizedAnswer answer = synthesizer.synthesize("How many vacation days?", CONTEXT, "Acme Corp");

        assertThat(answer.answer()).isEqualTo("Employees receive 20 days.");
        assertThat(answer.sources()).containsExactly(new Source("handbook.md", "20 vacation days"));
        assertThat(answer.confidence()).isEqualTo(0.92);
        assertThat(answer.insufficientContext()).isFalse();
        assertThat(answer.tokenUsage().total()).isEqualTo(150);

        ArgumentCaptor<OpenAiChatClient.Request> captor = ArgumentCaptor.forClass(OpenAiChatClient.Request.class);
        verify(chatClient).complete(captor.capture());
        OpenAiChatClient.Request request = captor.getValue();
        assertThat(request.model()).isEqualTo("gpt-4.1-mini");
        assertThat(request.temperature()).isEqualTo(0.3);
        assertThat(request.maxTokens()).isEqualTo(1000);
        assertThat(request.jsonResponse()).isTrue();
        assertThat(request.messages().get(0).content()).contains("Acme Corp");
        assertThat(request.messages().get(1).content())
                .contains("--- Document: handbook.md (Chunk 1) ---")
                .contains("--- Document: benefits.md (Chunk 3) ---")
                .contains("QUESTION:\nHow many vacation days?");
    }

    @Test
    void clampsConfidenceAndNormalisesBlankAnswer() {
        when(chatClient.complete(any())).thenReturn(completion("""
                {"answer":"  ","sources":[],"confidence":1.7,"insufficient_context":true}
                """));

        SynthesizedAnswer answer = synthesizer().synthesize("Unknown topic?", CONTEXT, null);

        assertThat(answer.answer()).isNull();
        assertThat(answer.confidence()).isEqualTo(1.0);
        assertThat(answer.insufficientContext()).isTrue();
    }

    @Test
    void missingConfidenceIsZero() {
        when(chatClient.complete(any())).thenReturn(completion("{\"answer\":\"Yes.\"}"));

        SynthesizedAnswer answer = synthesizer().synthesize("Is parking free?", CONTEXT, "Acme");

        assertThat(answer.confidence()).isZero();
        assertThat(answer.sources()).isEmpty();
    }

    @Test
    void malformedJsonIsUpstreamFailure() {
        when(chatClient.complete(any())).thenReturn(completion("Sure! Employees get 20 days."));

        assertThatThrownBy(() -> synthesizer().synthesize("How many vacation days?", CONTEXT, "Acme"))
                .isInstanceOf(UpstreamFailureException.class);
    }

    private OpenAiAnswerSynthesizer synthesizer() {
        return new OpenAiAnswerSynthesizer(chatClient, new ObjectMapper(), "gpt-4.1-mini", 0.3, 1000);
    }

    private OpenAiChatClient.ChatCompletionResponse completion(String content) {
        return new OpenAiChatClient.ChatCompletionResponse(
                List.of(new OpenAiChatClient.Choice(new OpenAiChatClient.Message("assistant", content), "stop")),
                new OpenAiChatClient.Usage(150, 120, 30));
    }
}
