package com.branchlifecycle.reconciler.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SlackServiceTest {

    private Slack slack;
    private MethodsClient methods;
    private SlackService slackService;

    @BeforeEach
    void setUp() {
        slack = mock(Slack.class);
        methods = mock(MethodsClient.class);
        when(slack.methods("xoxb-test")).thenReturn(methods);
        slackService = new SlackService(slack);
    }

    @Test
    void shouldSkipWhenTokenIsMissing() {
        assertFalse(slackService.isConfigured());

        assertNull(slackService.postMessage("C123", "hello"));
        verifyNoInteractions(slack);
    }

    @Test
    void shouldSkipWhenChannelIsMissing() {
        slackService.setSlackBotToken("xoxb-test");

        assertNull(slackService.postMessage(null, "hello"));
        verifyNoInteractions(slack);
    }

    @Test
    void shouldReturnTimestampOfPostedMessage() throws Exception {
        slackService.setSlackBotToken("xoxb-test");
        ChatPostMessageResponse response = new ChatPostMessageResponse();
        response.setOk(true);
        response.setTs("1700000000.000100");
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        assertEquals("1700000000.000100", slackService.postMessage("C123", "Auto-cleanup: deleted 1"));
    }

    @Test
    void shouldSwallowTransportFailure() throws Exception {
        slackService.setSlackBotToken("xoxb-test");
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("offline"));

        assertNull(slackService.postMessage("C123", "hello"));
    }

    @Test
    void shouldSwallowApiError() throws Exception {
        slackService.setSlackBotToken("xoxb-test");
        SlackApiException error = mock(SlackApiException.class);
        when(error.getMessage()).thenReturn("status: 429, body: ratelimited");
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(error);

        assertNull(slackService.postMessage("C123", "hello"));
    }
}
