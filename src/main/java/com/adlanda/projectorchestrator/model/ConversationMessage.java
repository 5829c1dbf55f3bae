package com.adlanda.projectorchestrator.model;

import java.time.Instant;

/**
 * One entry of a project's conversation history.
 *
 * @param role      Speaker, e.g. "user" or "assistant"
 * @param content   Message text
 * @param timestamp When the message was appended
 */
public record ConversationMessage(String role, String content, Instant timestamp) {}
