package com.eainde.forecast.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.ArrayList;
import java.util.Set;

/**
 * {@link ModelBackend} over any LangChain4j {@link ChatModel} (Gemini, Ollama, ...).
 *
 * <p>Makes one call per invocation; the underlying model must be built with
 * {@code maxRetries(0)} so retries are owned by {@link ResilientModelClient}.</p>
 */
public class ChatModelBackend implements ModelBackend {

    private final ChatModel chatModel;
    private final String name;
    private final ResponseFormat responseFormat;

    public ChatModelBackend(ChatModel chatModel, String name) {
        this(chatModel, name, null);
    }

    /**
     * @param jsonSchema when non-null the model is asked for JSON constrained to this schema
     */
    public ChatModelBackend(ChatModel chatModel, String name, JsonSchema jsonSchema) {
        this.chatModel = chatModel;
        this.name = name;
        this.responseFormat = jsonSchema == null
                ? null
                : ResponseFormat.builder().type(ResponseFormatType.JSON).jsonSchema(jsonSchema).build();
    }

    @Override
    public String complete(String prompt, Set<String> stopSequences) {
        DefaultChatRequestParameters.Builder<?> parameters = DefaultChatRequestParameters.builder();
        if (stopSequences != null && !stopSequences.isEmpty()) {
            parameters.stopSequences(new ArrayList<>(stopSequences));
        }
        if (responseFormat != null) {
            parameters.responseFormat(responseFormat);
        }

        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .parameters(parameters.build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw ModelErrorClassifier.toBackendException(name, e);
        }

        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        if (text == null || text.isBlank()) {
            throw ModelBackendException.transientFailure(name + " returned an empty completion");
        }
        return text;
    }

    @Override
    public String name() {
        return name;
    }
}
