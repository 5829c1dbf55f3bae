package com.adlanda.projectorchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted conversation state of one project.
 *
 * @param projectId    Owning project
 * @param messages     Messages in append order
 * @param lastAccessed Last time the context was switched to or written
 */
public record ConversationContext(String projectId, List<ConversationMessage> messages, Instant lastAccessed) {

    public ConversationContext {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public static ConversationContext empty(String projectId) {
        return new ConversationContext(projectId, List.of(), Instant.now());
    }
}
