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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionExplainerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @Mock
    private LlmClient llm;

    private final ToolContext context = ToolContext.create();

    @Test
    void getDependencies_areTheContextProviders() {
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT,
                List.of(section("alpha", "A", 0.1), section("beta", "B", 0.2)));

        assertThat(explainer.getName()).isEqualTo(ToolNames.TRANSACTION_EXPLAINER);
        assertThat(explainer.getDependencies()).containsExactly("alpha", "beta");
    }

    @Test
    void buildPrompt_keepsProviderOrderAndRanksFacts() {
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, List.of(
                section("alpha", "### Alpha:\n- one", 0.3),
                section("silent", "  ", 0.0),
                section("beta", "### Beta:\n- two\n", 0.9)));

        String prompt = explainer.buildPrompt(context, new Baggage());

        assertThat(prompt).isEqualTo("""
                ## Decoded Transaction Data:

                ### Alpha:
                - one

                ### Beta:
                - two

                ### Key facts:
                - fact from beta
                - fact from alpha
                - fact from silent

                Write the one-sentence explanation now.""");
    }

    @Test
    void buildPrompt_limitsKeyFacts() {
        List<Tool> providers = new java.util.ArrayList<>();
        for (int i = 0; i < TransactionExplainer.MAX_RAG_ITEMS + 3; i++) {
            providers.add(section("p" + i, "", i / 100.0));
        }
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, providers);

        String prompt = explainer.buildPrompt(context, new Baggage());

        assertThat(prompt.lines().filter(line -> line.startsWith("- fact from"))).hasSize(TransactionExplainer.MAX_RAG_ITEMS);
        assertThat(prompt).doesNotContain("- fact from p0\n");
    }

    @Test
    @SuppressWarnings("unchecked")
    void process_sendsSystemAndUserMessagesAndStoresStrippedReply() {
        when(llm.complete(anyList(), eq(TIMEOUT))).thenReturn("  Alice sent 5 USDC to Bob.  ");
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, List.of(section("alpha", "### Alpha:", 0.5)));
        Baggage baggage = new Baggage();

        explainer.process(context, baggage);

        assertThat(baggage.get(BaggageKeys.EXPLANATION)).contains("Alice sent 5 USDC to Bob.");
        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(llm).complete(messages.capture(), eq(TIMEOUT));
        assertThat(messages.getValue()).extracting(ChatMessage::role).containsExactly("system", "user");
        assertThat(messages.getValue().get(0).content()).isEqualTo(TransactionExplainer.SYSTEM_PROMPT);
        assertThat(messages.getValue().get(1).content()).startsWith("## Decoded Transaction Data:\n\n### Alpha:");
        assertThat(explainer.getPromptContext(context, baggage)).isEqualTo("### Explanation:\nAlice sent 5 USDC to Bob.");
    }

    @Test
    void process_llmFailure_raisesLlmUnavailable() {
        LlmException cause = new LlmException("LLM returned HTTP 503: busy", true);
        when(llm.complete(anyList(), any())).thenThrow(cause);
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, List.of());

        assertThatThrownBy(() -> explainer.process(context, new Baggage()))
                .isInstanceOf(ToolException.class)
                .hasMessage("Language model call failed: LLM returned HTTP 503: busy")
                .hasCause(cause)
                .extracting("code").isEqualTo("LLM_UNAVAILABLE");
    }

    @Test
    void process_cancelledRun_neverCallsModel() {
        ToolContext cancelled = ToolContext.create();
        cancelled.cancel();
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, List.of());

        assertThatThrownBy(() -> explainer.process(cancelled, new Baggage()))
                .isInstanceOf(CancellationException.class);
        verifyNoInteractions(llm);
    }

    @Test
    void getPromptContext_emptyBeforeProcessing() {
        TransactionExplainer explainer = new TransactionExplainer(llm, TIMEOUT, List.of());

        assertThat(explainer.getPromptContext(context, new Baggage())).isEmpty();
    }

    private static Tool section(String name, String prompt, double relevance) {
        return new Tool() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return "Test provider " + name;
            }

            @Override
            public List<String> getDependencies() {
                return List.of();
            }

            @Override
            public void process(ToolContext context, Baggage baggage) {
            }

            @Override
            public String getPromptContext(ToolContext context, Baggage baggage) {
                return prompt;
            }

            @Override
            public RagContext getRagContext(ToolContext context, Baggage baggage) {
                return RagContext.empty().addItem(new RagContextItem("fact:" + name, "fact", name,
                        "fact from " + name, Map.of(), List.of(), relevance));
            }
        };
    }
}
