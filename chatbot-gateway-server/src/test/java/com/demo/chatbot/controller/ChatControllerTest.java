package com.demo.chatbot.controller;

import com.demo.chatbot.domain.BotResponse;
import com.demo.chatbot.domain.ConversationLogEntity;
import com.demo.chatbot.domain.IncomingMessage;
import com.demo.chatbot.domain.ResponseSource;
import com.demo.chatbot.service.ChatHistoryService;
import com.demo.chatbot.service.MessagePipeline;
import com.demo.chatbot.service.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock
    private MessagePipeline messagePipeline;

    @Mock
    private ChatHistoryService chatHistoryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChatController(messagePipeline, chatHistoryService, new MetricsService()))
                .build();
    }

    @Test
    void messageIsAnsweredThroughPipeline() throws Exception {
        when(messagePipeline.process(any(IncomingMessage.class))).thenReturn(BotResponse.builder()
                .text("Hello! Welcome.")
                .source(ResponseSource.GREETING)
                .confidence(1.0)
                .build());

        mockMvc.perform(post("/api/v1/chat/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\",\"sender_id\":\"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Hello! Welcome."))
                .andExpect(jsonPath("$.sender_id").value("u1"))
                .andExpect(jsonPath("$.recipient_id").value("chatbot"))
                .andExpect(jsonPath("$.confidence").value(1.0))
                .andExpect(jsonPath("$.timestamp").exists());

        ArgumentCaptor<IncomingMessage> captor = ArgumentCaptor.forClass(IncomingMessage.class);
        verify(messagePipeline).process(captor.capture());
        assertThat(captor.getValue().getText()).isEqualTo("hello");
    }

    @Test
    void missingSenderIsGenerated() throws Exception {
        when(messagePipeline.process(any(IncomingMessage.class))).thenReturn(BotResponse.error("Empty message received"));

        mockMvc.perform(post("/api/v1/chat/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sender_id").isNotEmpty())
                .andExpect(jsonPath("$.response").value("Empty message received"));
    }

    @Test
    void missingMessageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chat/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sender_id\":\"u1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad request"));

        verifyNoInteractions(messagePipeline);
    }

    @Test
    void unexpectedFaultIsInternalError() throws Exception {
        when(messagePipeline.process(any(IncomingMessage.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/chat/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"))
                .andExpect(jsonPath("$.detail").value("boom"));
    }

    @Test
    void historyIsReturnedNewestFirst() throws Exception {
        when(chatHistoryService.getHistory("u1")).thenReturn(List.of(
                ConversationLogEntity.builder().userId("u1").userMessage("second").botResponse("b").build(),
                ConversationLogEntity.builder().userId("u1").userMessage("first").botResponse("a").build()));

        mockMvc.perform(get("/api/v1/chat/history/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sender_id").value("u1"))
                .andExpect(jsonPath("$.history.length()").value(2))
                .andExpect(jsonPath("$.history[0].user_message").value("second"));
    }

    @Test
    void clearHistoryReportsDeletedRows() throws Exception {
        when(chatHistoryService.clearHistory("u1")).thenReturn(3L);

        mockMvc.perform(delete("/api/v1/chat/history/u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Chat history cleared for u1"))
                .andExpect(jsonPath("$.deleted").value(3));
    }
}
