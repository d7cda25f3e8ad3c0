package me.golemcore.seeker.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One agent invocation as seen by an LLM provider: the role-specific model,
 * the stage prompt and the conversation so far (the payload, plus the invalid
 * output and repair instruction on a repair attempt).
 */
@Data
@Builder
public class LlmRequest {

    private String model;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Double temperature;
    private Integer maxTokens;

    /** Run the call belongs to, for log correlation. */
    private String runId;

    /** Agent stage such as {@code plan} or {@code read:1:r2}. */
    private String stage;
}
