package com.deepansh.mq.batch;

import com.deepansh.mq.exception.LlmException;
import com.deepansh.mq.exception.MergeConflictException;
import com.deepansh.mq.llm.LlmClient;
import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;
import com.deepansh.mq.model.Message;
import com.deepansh.mq.model.ModelConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RowProcessorTest {

    @Mock LlmClient llmClient;

    private static final ModelConfig MODEL = ModelConfig.builder()
            .provider("openai").model("gpt-4o-mini").sysprompt("Saved").build();

    private static BatchRow row(Map<String, Object> fields) {
        return new BatchRow(0, 1, fields);
    }

    private static Map<String, Object> fields(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) map.put((String) kv[i], kv[i + 1]);
        return map;
    }

    private RowProcessor processor(BatchOptions.BatchOptionsBuilder options) {
        return new RowProcessor(llmClient, options.modelShortname("m").model(MODEL).workers(1).build());
    }

    @Test
    void apply_success_mergesResponseAfterInputKeys() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("hello"));

        Map<String, Object> out = processor(BatchOptions.builder())
                .apply(row(fields("id", 1, "prompt", "hi")));

        assertThat(out.keySet()).containsExactly("id", "prompt", "mq_input_prompt", "response", "sysprompt");
        assertThat(out).containsEntry("response", "hello")
                .containsEntry("prompt", "hi")
                .containsEntry("mq_input_prompt", "hi")
                .containsEntry("sysprompt", "Saved");
    }

    @Test
    void apply_prefixSuffixAndOverride_shapeTheRequest() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("ok"));

        Map<String, Object> out = processor(BatchOptions.builder()
                .prefix("Translate: ").suffix(" (French)").sysprompt("Override")
                .timeout(Duration.ofSeconds(5)).maxRetries(0))
                .apply(row(fields("prompt", "cat")));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmClient).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertThat(request.getMessages()).containsExactly(
                Message.system("Override"), Message.user("Translate: cat (French)"));
        assertThat(request.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(request.getMaxRetries()).isZero();
        assertThat(out).containsEntry("prompt", "Translate: cat (French)")
                .containsEntry("mq_input_prompt", "cat")
                .containsEntry("sysprompt", "Override");
    }

    @Test
    void apply_requestFails_recordsErrorOnRow() {
        when(llmClient.chat(any())).thenThrow(new LlmException("Error (HTTP 500)",
                Map.of("provider", "openai", "status_code", 500)));

        Map<String, Object> out = processor(BatchOptions.builder()).apply(row(fields("prompt", "hi")));

        assertThat(out).containsEntry("error", "Error (HTTP 500)").doesNotContainKey("response");
        assertThat(out.get("error_info")).isEqualTo(Map.of("provider", "openai", "status_code", 500));
    }

    @Test
    void apply_reasoning_isIncluded() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("a", "because"));

        Map<String, Object> out = processor(BatchOptions.builder()).apply(row(fields("prompt", "q")));

        assertThat(out).containsEntry("reasoning", "because");
    }

    @Test
    void apply_extractTags_addsTagKeys() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("<lang>fr</lang><word>chat</word><word>chien</word>"));

        Map<String, Object> out = processor(BatchOptions.builder().extractTags(true))
                .apply(row(fields("prompt", "q")));

        assertThat(out).containsEntry("tag:lang", "fr")
                .containsEntry("tag:word", List.of("chat", "chien"));
    }

    @Test
    void apply_tagCollidesWithInputKey_throwsMergeConflict() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("<lang>fr</lang>"));

        RowProcessor processor = processor(BatchOptions.builder().extractTags(true));

        assertThatThrownBy(() -> processor.apply(new BatchRow(0, 4, fields("prompt", "q", "tag:lang", "en"))))
                .isInstanceOf(MergeConflictException.class)
                .hasMessageContaining("merge conflict on line 4")
                .hasMessageContaining("extracted tag")
                .hasMessageContaining("tag:lang");
    }

    @Test
    void apply_noSysprompt_omitsKeyAndSystemMessage() {
        when(llmClient.chat(any())).thenReturn(new ChatResult("ok"));
        RowProcessor processor = new RowProcessor(llmClient, BatchOptions.builder()
                .modelShortname("m")
                .model(ModelConfig.builder().provider("openai").model("g").build())
                .workers(1)
                .build());

        Map<String, Object> out = processor.apply(row(fields("prompt", "q")));

        assertThat(out).doesNotContainKey("sysprompt");
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmClient).chat(captor.capture());
        assertThat(captor.getValue().getMessages()).containsExactly(Message.user("q"));
    }
}
