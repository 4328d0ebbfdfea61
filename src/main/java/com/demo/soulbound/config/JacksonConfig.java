package com.demo.soulbound.config;

import com.demo.soulbound.service.Addresses;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.abi.datatypes.Address;

import java.io.IOException;
import java.math.BigInteger;
import java.util.TimeZone;

@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(addressModule())
                .build();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setTimeZone(TimeZone.getTimeZone("UTC"));
        return mapper;
    }

    /** Addresses as {@code 0x} hex strings; amounts as decimal strings so large values survive JavaScript clients. */
    static SimpleModule addressModule() {
        SimpleModule module = new SimpleModule("soulbound-types");
        module.addSerializer(Address.class, new JsonSerializer<>() {
            @Override
            public void serialize(Address value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeString(value.toString());
            }
        });
        module.addDeserializer(Address.class, new JsonDeserializer<>() {
            @Override
            public Address deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return Addresses.parse(p.getValueAsString());
            }
        });
        module.addSerializer(BigInteger.class, ToStringSerializer.instance);
        return module;
    }
}
