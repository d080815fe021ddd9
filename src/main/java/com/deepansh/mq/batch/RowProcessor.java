package com.deepansh.mq.batch;

import com.deepansh.mq.exception.LlmException;
import com.deepansh.mq.exception.MergeConflictException;
import com.deepansh.mq.llm.LlmClient;
import com.deepansh.mq.model.ChatRequest;
import com.deepansh.mq.model.ChatResult;
import com.deepansh.mq.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns one input row into its output row.
 *
 * Output keys, after the input's own: mq_input_prompt (prompt as read), prompt (with
 * prefix/suffix applied), response, reasoning and sysprompt when non-blank, then any
 * tag:* keys. A failed request becomes error (+ error_info) on the row instead of an
 * exception. A merge conflict is the one thing that escapes.
 */
@Slf4j
public class RowProcessor implements Function<BatchRow, Map<String, Object>> {

    private final LlmClient llmClient;
    private final BatchOptions options;

    public RowProcessor(LlmClient llmClient, BatchOptions options) {
        this.llmClient = llmClient;
        this.options = options;
    }

    @Override
    public Map<String, Object> apply(BatchRow row) {
        String inputPrompt = row.prompt();
        String finalPrompt = options.getPrefix() + inputPrompt + options.getSuffix();
        String sysprompt = options.effectiveSysprompt();

        Map<String, Object> out = new LinkedHashMap<>(row.fields());
        out.put(ReservedKeys.INPUT_PROMPT, inputPrompt);
        out.put(ReservedKeys.PROMPT, finalPrompt);

        ChatResult result = null;
        try {
            result = llmClient.chat(buildRequest(sysprompt, finalPrompt));
        } catch (LlmException e) {
            log.warn("Row {} failed: {}", row.index(), e.getMessage());
            out.put(ReservedKeys.ERROR, errorText(e));
            if (!e.getErrorInfo().isEmpty()) {
                out.put(ReservedKeys.ERROR_INFO, new LinkedHashMap<>(e.getErrorInfo()));
            }
        } catch (RuntimeException e) {
            log.warn("Row {} failed: {}", row.index(), e.toString());
            out.put(ReservedKeys.ERROR, errorText(e));
        }

        if (result != null) {
            out.put(ReservedKeys.RESPONSE, result.content());
            if (result.hasReasoning()) {
                out.put(ReservedKeys.REASONING, result.reasoning());
            }
        }
        if (sysprompt != null && !sysprompt.isBlank()) {
            out.put(ReservedKeys.SYSPROMPT, sysprompt);
        }
        if (result != null && options.isExtractTags()) {
            for (Map.Entry<String, Object> tag : TagExtractor.extract(result.content()).entrySet()) {
                String key = ReservedKeys.tagKey(tag.getKey());
                if (out.containsKey(key)) {
                    throw MergeConflictException.tagCollision(row.lineNumber(), key);
                }
                out.put(key, tag.getValue());
            }
        }
        return out;
    }

    private ChatRequest buildRequest(String sysprompt, String prompt) {
        List<Message> messages = new ArrayList<>(2);
        if (sysprompt != null && !sysprompt.isBlank()) {
            messages.add(Message.system(sysprompt));
        }
        messages.add(Message.user(prompt));
        return ChatRequest.forModel(options.getModel())
                .messages(messages)
                .timeout(options.getTimeout())
                .maxRetries(options.getMaxRetries())
                .build();
    }

    private static String errorText(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
