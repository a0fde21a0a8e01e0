package com.eainde.forecast.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;

/**
 * Logs timing and token usage of every chat model call. Prompt text is never logged.
 */
@Log4j2
public class ModelCallLoggingListener implements ChatModelListener {

    private static final String START_TIME = "forecast.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
        log.debug("Sending {} message(s) to {}", requestContext.chatRequest().messages().size(),
                requestContext.modelProvider());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object started = responseContext.attributes().get(START_TIME);
        long duration = started instanceof Long s ? System.currentTimeMillis() - s : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Model responded in {}ms, tokens in={} out={} total={}", duration,
                    usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("Model responded in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Model call failed: {}", ModelErrorClassifier.shortMessage(errorContext.error().getMessage()));
    }
}
