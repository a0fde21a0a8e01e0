package com.eainde.forecast.llm;

import java.util.Set;

/**
 * A language model that completes a prompt. Implementations make exactly one call per
 * invocation; retrying belongs to {@link ResilientModelClient}.
 */
public interface ModelBackend {

    /**
     * @param prompt        full prompt text
     * @param stopSequences optional stop sequences, may be empty
     * @return completion text
     * @throws ModelBackendException on any backend failure
     */
    String complete(String prompt, Set<String> stopSequences);

    default String complete(String prompt) {
        return complete(prompt, Set.of());
    }

    /**
     * Short identifier used in logs and trace entries.
     */
    String name();
}
