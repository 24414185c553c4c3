package com.seatwatch.monitor.service.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("HttpNotificationSender Unit Tests")
class HttpNotificationSenderTest {

    private static final String GATEWAY_URL = "http://mail-gateway.test/send";

    private MockRestServiceServer server;
    private HttpNotificationSender sender;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sender = new HttpNotificationSender(restTemplate, GATEWAY_URL);
    }

    @Test
    @DisplayName("Should post the message and report success on 2xx")
    void send_GatewayAccepts_ReturnsTrue() {
        server.expect(requestTo(GATEWAY_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.to").value("a@example.com"))
                .andExpect(jsonPath("$.subject").value("Seats available"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        boolean sent = sender.send("a@example.com", "Seats available", "body");

        assertThat(sent).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("Should report failure when the gateway errors")
    void send_GatewayError_ReturnsFalse() {
        server.expect(requestTo(GATEWAY_URL)).andRespond(withServerError());

        assertThat(sender.send("a@example.com", "s", "b")).isFalse();
    }

    @Test
    @DisplayName("Should not call the gateway without a recipient")
    void send_NoRecipient_ReturnsFalse() {
        assertThat(sender.send(" ", "s", "b")).isFalse();
        server.verify();
    }
}
