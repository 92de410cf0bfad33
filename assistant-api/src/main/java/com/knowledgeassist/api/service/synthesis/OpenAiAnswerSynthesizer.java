package com.knowledgeassist.api.service.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.model.RetrievedFragment;
import com.knowledgeassist.api.model.Source;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import com.knowledgeassist.api.service.synthesis.openai.OpenAiChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class OpenAiAnswerSynthesizer implements AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAnswerSynthesizer.class);

    private static final String SYSTEM_PROMPT = """
            You are the internal knowledge assistant for %s. Answer employee questions using ONLY the context \
            documents supplied with each question.

            Rules:
            1. Use nothing but the supplied context; never rely on outside knowledge or guess.
            2. Cite every document you rely on by its name.
            3. If the context does not contain enough to answer, set insufficient_context to true and answer to null.
            4. Keep answers concise, complete and in professional business language.

            Reply with a single JSON object.""";

    private static final String RESPONSE_FORMAT = """
            Reply in exactly this JSON shape:
            {
              "answer": "the answer, or null when the context is insufficient",
              "sources": [
                {"document_name": "name of a source document", "relevant_excerpt": "short supporting quote"}
              ],
              "confidence": 0.85,
              "insufficient_context": false
            }
            confidence is a number between 0 and 1 describing how well the context supports the answer.""";

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    public OpenAiAnswerSynthesizer(OpenAiChatClient chatClient,
                                   ObjectMapper objectMapper,
                                   @Value("${assistant.llm.model:gpt-4.1-mini}") String model,
                                   @Value("${assistant.llm.temperature:0.3}") double temperature,
                                   @Value("${assistant.llm.max-output-tokens:1000}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.model = model;
        this.temperature = temperature;
        this.maxOutputTokens = Math.max(64, maxOutputTokens);
    }

    @Override
    public SynthesizedAnswer synthesize(String question, List<RetrievedFragment> context, String tenantName) {
        List<OpenAiChatClient.Message> messages = List.of(
                new OpenAiChatClient.Message("system", SYSTEM_PROMPT.formatted(
                        tenantName == null || tenantName.isBlank() ? "your organization" : tenantName)),
                new OpenAiChatClient.Message("user", userPrompt(question, context))
        );
        OpenAiChatClient.ChatCompletionResponse response = chatClient.complete(
                new OpenAiChatClient.Request(model, messages, temperature, maxOutputTokens, true));

        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null) {
            throw new UpstreamFailureException("Chat completion returned no content");
        }
        ModelAnswer parsed = parse(choice.message().content());
        SynthesizedAnswer.TokenUsage usage = response.usage() == null
                ? SynthesizedAnswer.TokenUsage.NONE
                : new SynthesizedAnswer.TokenUsage(
                        response.usage().promptTokens(),
                        response.usage().completionTokens(),
                        response.usage().totalTokens());
        return new SynthesizedAnswer(
                blankToNull(parsed.answer()),
                toSources(parsed.sources()),
                clamp(parsed.confidence()),
                Boolean.TRUE.equals(parsed.insufficientContext()),
                usage);
    }

    String userPrompt(String question, List<RetrievedFragment> context) {
        StringBuilder builder = new StringBuilder("CONTEXT DOCUMENTS:\n");
        for (int i = 0; i < context.size(); i++) {
            RetrievedFragment fragment = context.get(i);
            if (i > 0) {
                builder.append("\n\n");
            }
            builder.append(String.format(Locale.ROOT, "--- Document: %s (Chunk %d) ---\n",
                            fragment.documentName(), fragment.chunkIndex() + 1))
                    .append(fragment.chunkText())
                    .append("\n---");
        }
        builder.append("\n\nQUESTION:\n")
                .append(question == null ? "" : question.trim())
                .append("\n\n")
                .append(RESPONSE_FORMAT);
        return builder.toString();
    }

    private ModelAnswer parse(String content) {
        try {
            return objectMapper.readValue(content, ModelAnswer.class);
        } catch (JsonProcessingException e) {
            log.warn("Chat completion returned malformed JSON: {}", e.getOriginalMessage());
            throw new UpstreamFailureException("Chat completion returned malformed JSON", e);
        }
    }

    private List<Source> toSources(List<ModelSource> sources) {
        if (sources == null) {
            return List.of();
        }
        List<Source> result = new ArrayList<>();
        for (ModelSource source : sources) {
            if (source != null && source.documentName() != null) {
                result.add(new Source(source.documentName(), source.relevantExcerpt() == null ? "" : source.relevantExcerpt()));
            }
        }
        return result;
    }

    private double clamp(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record ModelAnswer(String answer,
                               List<ModelSource> sources,
                               Double confidence,
                               @JsonProperty("insufficient_context") Boolean insufficientContext) {
    }

    private record ModelSource(@JsonProperty("document_name") String documentName,
                               @JsonProperty("relevant_excerpt") String relevantExcerpt) {
    }
}
