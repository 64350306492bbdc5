package com.webauth.backend.modules.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.webauth.backend.modules.sse.application.EventBroadcaster;
import com.webauth.backend.modules.sse.domain.SseMessage;
import com.webauth.backend.support.AbstractPostgresIntegrationTest;
import com.webauth.backend.support.TestUserFactory;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class EventStreamControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final long WAIT_MILLIS = 3000;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventBroadcaster broadcaster;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void streamDeliversPublishedFrames() throws Exception {
        MvcResult result = mockMvc.perform(get("/event").param("event", "event1"))
                .andExpect(request().asyncStarted())
                .andReturn();
        try {
            assertThat(broadcaster.snapshot().get("event1")).hasSize(1);

            broadcaster.publish(SseMessage.of("event1", "hello\nworld"));

            String body = awaitContent(result, "data: world\n\n");
            assertThat(body).contains("event: event1\ndata: hello\ndata: world\n\n");
            assertThat(result.getResponse().getHeader(HttpHeaders.CONTENT_TYPE)).startsWith("text/event-stream");
            assertThat(result.getResponse().getHeader(HttpHeaders.CACHE_CONTROL)).isEqualTo("no-cache");
            assertThat(result.getResponse().getHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");
        } finally {
            result.getRequest().getAsyncContext().complete();
        }

        assertThat(broadcaster.snapshot().get("event1")).isEmpty();
    }

    @Test
    void quietStreamSendsHeartbeatAndUnsubscribesWhenClosed() throws Exception {
        MvcResult result = mockMvc.perform(get("/event").param("event", "event2"))
                .andExpect(request().asyncStarted())
                .andReturn();
        try {
            assertThat(broadcaster.snapshot().get("event2")).hasSize(1);

            assertThat(awaitContent(result, ":\n\n")).startsWith(":\n\n");
        } finally {
            result.getRequest().getAsyncContext().complete();
        }

        assertThat(broadcaster.snapshot().get("event2")).isEmpty();
    }

    @Test
    void formPagesKeepNoStoreCaching() throws Exception {
        mockMvc.perform(get("/login"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, containsString("no-store")));
    }

    @Test
    void streamForUnknownEventIsRejected() throws Exception {
        mockMvc.perform(get("/event").param("event", "nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_REGISTERED"));
    }

    @Test
    void sendRequiresAdminSession() throws Exception {
        mockMvc.perform(post("/event/send").param("event", "event1").param("data", "x"))
                .andExpect(status().isUnauthorized());

        testUserFactory.createUser("alice", "pw");
        mockMvc.perform(post("/event/send")
                        .cookie(new Cookie("session", login("alice", "pw")))
                        .param("event", "event1")
                        .param("data", "x"))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminCanPublishToRegisteredEvents() throws Exception {
        testUserFactory.createAdmin("root", "secret");
        Cookie session = new Cookie("session", login("root", "secret"));

        mockMvc.perform(post("/event/send").cookie(session)
                        .param("event", "event2")
                        .param("data", "x")
                        .param("id", "7")
                        .param("retry", "1000"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/event/send").cookie(session)
                        .param("event", "event2")
                        .param("retry", "soon"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_RETRY"));
        mockMvc.perform(post("/event/send").cookie(session)
                        .param("event", "nope")
                        .param("data", "x"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_REGISTERED"));
    }

    private String login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/login")
                        .param("username", username)
                        .param("password", password))
                .andExpect(status().isSeeOther())
                .andReturn();
        Cookie cookie = result.getResponse().getCookie("session");
        assertThat(cookie).isNotNull();
        return cookie.getValue();
    }

    private static String awaitContent(MvcResult result, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        String body = result.getResponse().getContentAsString();
        while (!body.contains(expected) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            body = result.getResponse().getContentAsString();
        }
        return body;
    }
}
