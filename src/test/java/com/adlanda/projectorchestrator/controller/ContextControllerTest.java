package com.adlanda.projectorchestrator.controller;

import com.adlanda.projectorchestrator.config.WorkspaceProperties;
import com.adlanda.projectorchestrator.exception.NoActiveProjectException;
import com.adlanda.projectorchestrator.manager.ConversationContextManager;
import com.adlanda.projectorchestrator.model.ConversationMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContextController.class)
@Import(WorkspaceProperties.class)
class ContextControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationContextManager contextManager;

    @Test
    void messages_activeProject_returnsHistory() throws Exception {
        when(contextManager.current()).thenReturn(Optional.of("p1"));
        when(contextManager.getMessages()).thenReturn(List.of(
                new ConversationMessage("user", "hello", Instant.parse("2024-01-01T10:00:00Z"))));

        mockMvc.perform(get("/api/v1/context/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectId").value("p1"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("hello"));
    }

    @Test
    void messages_noActiveProject_returnsConflict() throws Exception {
        when(contextManager.getMessages()).thenThrow(new NoActiveProjectException("No conversation context is loaded"));

        mockMvc.perform(get("/api/v1/context/messages"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("No conversation context is loaded"));
    }

    @Test
    void addMessage_validRequest_returnsCreated() throws Exception {
        when(contextManager.addMessage("user", "How does switching work?"))
                .thenReturn(new ConversationMessage("user", "How does switching work?", Instant.now()));

        mockMvc.perform(post("/api/v1/context/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"role": "user", "content": "How does switching work?"}
                            """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("user"))
                .andExpect(jsonPath("$.content").value("How does switching work?"));
    }

    @Test
    void addMessage_missingRole_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/context/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"content": "orphan"}
                            """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(contextManager);
    }

    @Test
    void clear_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/context/messages"))
                .andExpect(status().isNoContent());

        verify(contextManager).clear();
    }

    @Test
    void recent_usesDefaultWindowWhenNotGiven() throws Exception {
        when(contextManager.current()).thenReturn(Optional.of("p1"));
        when(contextManager.recentContext(4000)).thenReturn("user: hello");

        mockMvc.perform(get("/api/v1/context/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.context").value("user: hello"));
    }

    @Test
    void recent_explicitWindow_isPassedThrough() throws Exception {
        when(contextManager.current()).thenReturn(Optional.of("p1"));
        when(contextManager.recentContext(100)).thenReturn("");

        mockMvc.perform(get("/api/v1/context/recent").param("maxChars", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.context").value(""));
    }
}
