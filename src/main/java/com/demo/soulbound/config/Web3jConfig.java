package com.demo.soulbound.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.io.IOException;

@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnExpression("!'${web3.rpc-url:}'.isEmpty()")
    public Web3j web3j(Environment env) {
        String rpc = env.getProperty("web3.rpc-url");
        return Web3j.build(new HttpService(rpc));
    }

    /**
     * Configured domain id, or the chain id of the configured node when none is set.
     * Falls back to 0 without a node.
     */
    static long resolveDomainId(long configured, ObjectProvider<Web3j> web3j) {
        if (configured != 0) {
            return configured;
        }
        Web3j client = web3j.getIfAvailable();
        if (client == null) {
            log.warn("No soulbound.domain-id and no web3.rpc-url; signed authorizations bind to domain 0");
            return 0;
        }
        try {
            long chainId = client.ethChainId().send().getChainId().longValueExact();
            log.info("Domain id {} read from node", chainId);
            return chainId;
        } catch (IOException ex) {
            throw new IllegalStateException("Could not read chain id from node: " + ex.getMessage(), ex);
        }
    }
}
