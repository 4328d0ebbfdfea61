package com.demo.soulbound.service.treasury;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookTreasurySinkTest {

    private static final String URL = "http://treasury.local/forward";
    private static final Address FROM = new Address("0x0000000000000000000000000000000000000b0b");
    private static final Address TREASURY = new Address("0x00000000000000000000000000000000000000c3");

    private MockRestServiceServer server;
    private WebhookTreasurySink sink;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        sink = new WebhookTreasurySink(rest, URL, new InMemoryTreasurySink());
    }

    @Test
    void postsForwardThenBooksItLocally() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.amount").value("250"))
                .andExpect(jsonPath("$.treasury").value(TREASURY.toString()))
                .andRespond(withSuccess());

        sink.deposit(FROM, TREASURY, BigInteger.valueOf(250));

        server.verify();
        assertThat(sink.balanceOf(TREASURY)).isEqualTo(BigInteger.valueOf(250));
    }

    @Test
    void failedPostIsRethrownAndNotBooked() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> sink.deposit(FROM, TREASURY, BigInteger.ONE))
                .isInstanceOf(TreasuryForwardException.class);

        assertThat(sink.balanceOf(TREASURY)).isZero();
    }
}
