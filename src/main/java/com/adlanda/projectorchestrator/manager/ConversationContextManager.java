package com.adlanda.projectorchestrator.manager;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.model.ConversationContext;
import com.adlanda.projectorchestrator.model.ConversationMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Keeps the conversation history of the active project.
 *
 * Histories live in {@code <contexts-dir>/<project-id>.json} and are saved
 * after every message. Appending and switching share the manager's write
 * lock, so a message always lands in the project that was active when it
 * was added.
 */
@Component
public class ConversationContextManager extends AbstractResourceManager {

    public static final String NAME = "context";

    private final Path contextsDir;
    private final int maxMessages;
    private final ObjectMapper objectMapper;

    private ConversationContext context;

    @Autowired
    public ConversationContextManager(WorkspaceProperties properties, ObjectMapper objectMapper) {
        this(properties.resolveContextsDir(), properties.getContext().getMaxMessages(), objectMapper);
    }

    ConversationContextManager(Path contextsDir, int maxMessages, ObjectMapper objectMapper) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.contextsDir = contextsDir;
        this.maxMessages = maxMessages;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public Path contextFile(String projectId) {
        requireValidId(projectId);
        return contextsDir.resolve(projectId + ".json");
    }

    @Override
    protected Path artifactPath(String projectId) {
        return contextFile(projectId);
    }

    /**
     * Appends a message to the active project's history and saves it.
     * The oldest messages are dropped beyond the configured maximum.
     *
     * @throws NoActiveProjectException if no project is loaded
     */
    public ConversationMessage addMessage(String role, String content) {
        lock.writeLock().lock();
        try {
            String projectId = requireLoaded();
            ConversationMessage message = new ConversationMessage(role, content, Instant.now());

            LinkedList<ConversationMessage> messages = new LinkedList<>(context.messages());
            messages.add(message);
            while (messages.size() > maxMessages) {
                messages.removeFirst();
            }
            context = new ConversationContext(projectId, messages, message.timestamp());

            try {
                save(context);
            } catch (IOException e) {
                // Kept in memory; written again on the next append or on release.
                log.warn("Could not save context of project {}: {}", projectId, e.getMessage());
            }
            log.debug("Added {} message to project {}", role, projectId);
            return message;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Messages of the active project, oldest first.
     *
     * @throws NoActiveProjectException if no project is loaded
     */
    public List<ConversationMessage> getMessages() {
        lock.readLock().lock();
        try {
            requireLoaded();
            return context.messages();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The most recent messages rendered as {@code role: content} lines, newest
     * messages kept first, in chronological order, within {@code maxChars}.
     */
    public String recentContext(int maxChars) {
        lock.readLock().lock();
        try {
            requireLoaded();
            List<ConversationMessage> messages = context.messages();
            List<String> parts = new ArrayList<>();
            int total = 0;
            for (int i = messages.size() - 1; i >= 0; i--) {
                ConversationMessage m = messages.get(i);
                String line = m.role() + ": " + m.content() + "\n";
                if (total + line.length() > maxChars) {
                    break;
                }
                parts.add(0, line);
                total += line.length();
            }
            return String.join("", parts);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops the active project's history, on disk too.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            String projectId = requireLoaded();
            context = ConversationContext.empty(projectId);
            try {
                save(context);
            } catch (IOException e) {
                log.warn("Could not save cleared context of project {}: {}", projectId, e.getMessage());
            }
            log.info("Cleared conversation of project {}", projectId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected boolean activate(String projectId) {
        Path file = contextFile(projectId);
        if (!Files.isRegularFile(file)) {
            context = ConversationContext.empty(projectId);
            log.info("Created new conversation context for project {}", projectId);
            return true;
        }
        try {
            ConversationContext stored = objectMapper.readValue(file.toFile(), ConversationContext.class);
            context = new ConversationContext(projectId, stored.messages(), Instant.now());
            log.info("Loaded {} messages for project {}", context.messages().size(), projectId);
            return true;
        } catch (IOException e) {
            log.warn("Unreadable conversation context {}: {}", file, e.getMessage());
            return false;
        }
    }

    @Override
    protected void release(String projectId) throws IOException {
        try {
            save(context);
        } finally {
            context = null;
        }
    }

    private String requireLoaded() {
        String projectId = currentProjectId();
        if (projectId == null || context == null) {
            throw new NoActiveProjectException("No project is active for conversation context");
        }
        return projectId;
    }

    private void save(ConversationContext ctx) throws IOException {
        Path target = contextFile(ctx.projectId());
        Files.createDirectories(contextsDir);
        Path temp = Files.createTempFile(contextsDir, ctx.projectId(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), ctx);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
