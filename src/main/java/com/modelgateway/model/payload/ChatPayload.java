package com.modelgateway.model.payload;

import com.modelgateway.model.Capability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-turn chat request.
 */
@Value
@Builder
@Jacksonized
public class ChatPayload implements RequestPayload {

    @Singular
    List<Message> messages;

    Double temperature;

    @Override
    public String kind() {
        return "chat";
    }

    @Override
    public String normalizedText() {
        return messages.stream()
                .filter(msg -> msg.getContent() != null)
                .map(msg -> msg.getRole() + ": " + RequestPayload.normalize(msg.getContent()))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public Set<Capability> impliedCapabilities() {
        return Set.of(Capability.CHAT);
    }

    /**
     * Content of the system message, if any.
     */
    public String systemPrompt() {
        return messages.stream()
                .filter(msg -> "system".equals(msg.getRole()))
                .map(Message::getContent)
                .findFirst()
                .orElse(null);
    }
}
