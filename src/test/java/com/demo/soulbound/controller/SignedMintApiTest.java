package com.demo.soulbound.controller;

import com.demo.soulbound.support.EngineFixture;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "soulbound.mint-mode=SIGNATURE")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SignedMintApiTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000a1";

    @Autowired
    private MockMvc mvc;

    @DynamicPropertySource
    static void signer(DynamicPropertyRegistry registry) {
        registry.add("soulbound.signer", () -> EngineFixture.SIGNER.address().toString());
    }

    @Test
    void authorizationIsRedeemedOnce() throws Exception {
        String holder = "0x00000000000000000000000000000000000000e3";
        String created = mvc.perform(post("/api/credential-types").header(CallerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"signed\",\"startTime\":0,\"endTime\":0}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        long typeId = ((Number) JsonPath.read(created, "$.id")).longValue();

        String auth = mvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"" + holder + "\",\"typeId\":" + typeId + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nonce").value(0))
                .andReturn().getResponse().getContentAsString();
        String body = SoulboundApiTest.signedMintBody(holder, typeId, auth);

        // relayed by a third party
        mvc.perform(post("/api/mint/signed").header(CallerHeader.NAME, "0x00000000000000000000000000000000000000f2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nonce").value(1));

        mvc.perform(post("/api/mint/signed").header(CallerHeader.NAME, holder)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("ALREADY_CLAIMED"));

        mvc.perform(get("/api/holders/" + holder + "/balances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.holdings[0].typeId").value(typeId))
                .andExpect(jsonPath("$.holdings[0].balance").value(1));
    }

    @Test
    void tamperedSignatureIsRejected() throws Exception {
        String holder = "0x00000000000000000000000000000000000000e4";
        String other = "0x00000000000000000000000000000000000000e5";
        String created = mvc.perform(post("/api/credential-types").header(CallerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"tampered\",\"startTime\":0,\"endTime\":0}"))
                .andReturn().getResponse().getContentAsString();
        long typeId = ((Number) JsonPath.read(created, "$.id")).longValue();
        String auth = mvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"" + holder + "\",\"typeId\":" + typeId + "}"))
                .andReturn().getResponse().getContentAsString();

        mvc.perform(post("/api/mint/signed").header(CallerHeader.NAME, other)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SoulboundApiTest.signedMintBody(other, typeId, auth)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("INVALID_SIGNATURE"));
    }
}
