package me.golemcore.seeker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single conversation turn sent to an LLM provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    private String role; // user, assistant, system
    private String content;

    public static Message user(String content) {
        return new Message(ROLE_USER, content);
    }

    public static Message assistant(String content) {
        return new Message(ROLE_ASSISTANT, content);
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }
}
