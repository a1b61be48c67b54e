package com.deepansh.rag.memory;

import com.deepansh.rag.config.SessionProperties;
import com.deepansh.rag.llm.GenerationOptions;
import com.deepansh.rag.llm.LlmClient;
import com.deepansh.rag.llm.LlmException;
import com.deepansh.rag.llm.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationSummarizerTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @Mock LlmClient llmClient;

    private ConversationSummarizer summarizer;
    private List<ConversationMessage> older;

    @BeforeEach
    void setUp() {
        summarizer = new ConversationSummarizer(new SessionProperties(), llmClient);
        older = List.of(
                ConversationMessage.user("How do I earn points by walking every day?", TS),
                ConversationMessage.assistant("Walk and open the app.", TS, null));
    }

    @Test
    void summaryFor_cachesPerSessionAndTurnCount() {
        when(llmClient.generate(anyString(), any())).thenReturn(LlmResponse.builder().content(" Points via walking. ").build());

        String first = summarizer.summaryFor("s1", 11, older);
        String second = summarizer.summaryFor("s1", 11, older);

        assertThat(first).isEqualTo("Points via walking.");
        assertThat(second).isEqualTo(first);
        verify(llmClient, times(1)).generate(anyString(), any());
        assertThat(summarizer.cachedSummaries()).isEqualTo(1);
    }

    @Test
    void summaryFor_newTurnCount_isNewKey() {
        when(llmClient.generate(anyString(), any())).thenReturn(LlmResponse.builder().content("summary").build());

        summarizer.summaryFor("s1", 11, older);
        summarizer.summaryFor("s1", 12, older);

        verify(llmClient, times(2)).generate(anyString(), any());
    }

    @Test
    void summaryFor_llmFailure_returnsHeuristicAndCachesNothing() {
        when(llmClient.generate(anyString(), any())).thenThrow(new LlmException("bad key"));

        String summary = summarizer.summaryFor("s1", 11, older);

        assertThat(summary).isEqualTo("User asked about 'How do I earn points by walking every day?...'");
        assertThat(summarizer.cachedSummaries()).isZero();
    }

    @Test
    void summaryFor_blankResponse_usesFallback() {
        when(llmClient.generate(anyString(), any())).thenReturn(LlmResponse.builder().content("  ").build());

        assertThat(summarizer.summaryFor("s1", 11, older)).startsWith("User asked about");
    }

    @Test
    void summaryFor_passesSamplingSettingsAndTranscript() {
        when(llmClient.generate(anyString(), any())).thenReturn(LlmResponse.builder().content("ok").build());
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);

        summarizer.summaryFor("s1", 11, older);

        verify(llmClient).generate(prompt.capture(), options.capture());
        assertThat(prompt.getValue())
                .contains("User: How do I earn points by walking every day?")
                .contains("AI: Walk and open the app.");
        assertThat(options.getValue().temperature()).isEqualTo(0.3);
        assertThat(options.getValue().maxTokens()).isEqualTo(200);
    }

    @Test
    void fallbackSummary_truncatesAndHandlesNoUserMessage() {
        String longQuestion = "x".repeat(80);

        assertThat(ConversationSummarizer.fallbackSummary(List.of(ConversationMessage.user(longQuestion, TS))))
                .isEqualTo("User asked about '" + "x".repeat(50) + "...'");
        assertThat(ConversationSummarizer.fallbackSummary(List.of(ConversationMessage.assistant("hi", TS, null))))
                .isEqualTo("Earlier conversation");
    }

    @Test
    void concurrentMisses_sameKey_singleLlmCall() throws Exception {
        CountDownLatch inCall = new CountDownLatch(1);
        when(llmClient.generate(anyString(), any())).thenAnswer(inv -> {
            inCall.countDown();
            Thread.sleep(200);
            return LlmResponse.builder().content("shared").build();
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return summarizer.summaryFor("s1", 11, older);
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("shared");
            }
        } finally {
            pool.shutdownNow();
        }

        verify(llmClient, times(1)).generate(anyString(), any());
    }

    @Test
    void slowSummary_doesNotHoldUpOtherKeys() throws Exception {
        CountDownLatch slowInCall = new CountDownLatch(1);
        CountDownLatch releaseSlow = new CountDownLatch(1);
        when(llmClient.generate(anyString(), any())).thenAnswer(inv -> {
            String prompt = inv.getArgument(0);
            if (prompt.contains("slow topic")) {
                slowInCall.countDown();
                releaseSlow.await(5, TimeUnit.SECONDS);
                return LlmResponse.builder().content("slow").build();
            }
            return LlmResponse.builder().content("fast").build();
        });
        List<ConversationMessage> slowOlder = List.of(
                ConversationMessage.user("Tell me about the slow topic", TS),
                ConversationMessage.assistant("Sure.", TS, null));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> slow = pool.submit(() -> summarizer.summaryFor("s1", 11, slowOlder));
            assertThat(slowInCall.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> fast = pool.submit(() -> summarizer.summaryFor("s2", 11, older));

            assertThat(fast.get(2, TimeUnit.SECONDS)).isEqualTo("fast");
            assertThat(slow.isDone()).isFalse();

            releaseSlow.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
        } finally {
            releaseSlow.countDown();
            pool.shutdownNow();
        }
    }
}
