package com.demo.soulbound.service.treasury;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;
import java.util.Map;

/**
 * Posts each forward to a remote treasury endpoint, then books it locally.
 * A failed post is rethrown so the forwarding operation rolls back.
 */
@Slf4j
public class WebhookTreasurySink implements TreasurySink {

    private final RestTemplate rest;
    private final String url;
    private final TreasurySink local;

    public WebhookTreasurySink(RestTemplate rest, String url, TreasurySink local) {
        this.rest = rest;
        this.url = url;
        this.local = local;
    }

    @Override
    public void deposit(Address from, Address treasury, BigInteger amount) {
        Map<String, Object> body = Map.of(
                "from", from.toString(),
                "treasury", treasury.toString(),
                "amount", amount.toString());
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        try {
            rest.postForEntity(url, new HttpEntity<>(body, h), Void.class);
        } catch (RestClientException ex) {
            log.warn("Treasury forward of {} to {} failed: {}", amount, treasury, ex.toString());
            throw new TreasuryForwardException("Treasury forward failed: " + ex.getMessage(), ex);
        }
        local.deposit(from, treasury, amount);
    }

    @Override
    public BigInteger balanceOf(Address treasury) {
        return local.balanceOf(treasury);
    }
}
