package com.txlens.tools;

import com.txlens.llm.ChatMessage;
import com.txlens.llm.LlmClient;
import com.txlens.llm.LlmException;
import com.txlens.pipeline.Baggage;
import com.txlens.pipeline.RagContext;
import com.txlens.pipeline.RagContextItem;
import com.txlens.pipeline.Tool;
import com.txlens.pipeline.ToolContext;
import com.txlens.pipeline.ToolException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Asks the language model for a one-sentence explanation of the transaction. The prompt is assembled from
 * the prompt sections and the most relevant retrieval fragments of the context providers handed to the
 * constructor; those providers are also this tool's dependencies. Writes {@link BaggageKeys#EXPLANATION}.
 */
@Slf4j
public class TransactionExplainer implements Tool {

    static final int MAX_RAG_ITEMS = 10;

    static final String SYSTEM_PROMPT = """
            You are a blockchain transaction analyzer. Provide a very short, precise summary of what this \
            transaction accomplished, in a single sentence under 30 words.
            Focus only on the main action. Do not explain blockchain basics or add warnings.
            Use exact numbers for amounts and counts, never words like "several" or "multiple".
            Mention each token amount once. Transfers from the zero address are mints, transfers to it are burns.
            If the gas fee in USD is known, end with "+ $<fee> gas".""";

    private final LlmClient llm;
    private final Duration timeout;
    private final List<Tool> contextProviders;

    public TransactionExplainer(LlmClient llm, Duration timeout, List<Tool> contextProviders) {
        this.llm = Objects.requireNonNull(llm, "llm");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.contextProviders = List.copyOf(contextProviders);
    }

    @Override
    public String getName() {
        return ToolNames.TRANSACTION_EXPLAINER;
    }

    @Override
    public String getDescription() {
        return "Generates a natural-language explanation of the transaction with a language model";
    }

    @Override
    public List<String> getDependencies() {
        return contextProviders.stream().map(Tool::getName).toList();
    }

    @Override
    public void process(ToolContext context, Baggage baggage) {
        String prompt = buildPrompt(context, baggage);
        log.debug("Explainer prompt has {} chars from {} providers", prompt.length(), contextProviders.size());

        context.throwIfCancelled();
        String explanation;
        try {
            explanation = llm.complete(
                    List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(prompt)),
                    context.boundedTimeout(timeout));
        } catch (LlmException e) {
            throw new ToolException(getName(), "LLM_UNAVAILABLE", "Language model call failed: " + e.getMessage(), e);
        }
        baggage.put(BaggageKeys.EXPLANATION, explanation.strip());
    }

    String buildPrompt(ToolContext context, Baggage baggage) {
        StringBuilder sb = new StringBuilder("## Decoded Transaction Data:");
        RagContext rag = RagContext.empty();
        for (Tool provider : contextProviders) {
            String section = provider.getPromptContext(context, baggage);
            if (section != null && !section.isBlank()) {
                sb.append("\n\n").append(section.strip());
            }
            rag.merge(provider.getRagContext(context, baggage));
        }

        List<RagContextItem> top = rag.topByRelevance(MAX_RAG_ITEMS);
        if (!top.isEmpty()) {
            sb.append("\n\n### Key facts:");
            top.forEach(item -> sb.append("\n- ").append(item.content()));
        }
        sb.append("\n\nWrite the one-sentence explanation now.");
        return sb.toString();
    }

    @Override
    public String getPromptContext(ToolContext context, Baggage baggage) {
        return baggage.get(BaggageKeys.EXPLANATION)
                .map(text -> "### Explanation:\n" + text)
                .orElse("");
    }
}
