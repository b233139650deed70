package com.txlens.llm;

import java.time.Duration;
import java.util.List;

/**
 * Language model used to write the transaction explanation.
 */
public interface LlmClient {

    /**
     * @param timeout upper bound for one attempt
     * @return the assistant's reply text
     * @throws LlmException when the model is unreachable or every attempt failed
     */
    String complete(List<ChatMessage> messages, Duration timeout);
}
