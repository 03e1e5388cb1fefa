package com.bulut.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import org.web3j.crypto.StructuredDataEncoder;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * EIP-712 typed-data message: a domain tag plus one primary struct.
 *
 * {@link #toJson()} is exactly what a wallet is asked to sign
 * ({@code eth_signTypedData_v4}); {@link #digest()} is the 32-byte hash the
 * signature is checked against.
 */
@Value
public class StructuredMessage {

    private static final ObjectMapper JSON = new ObjectMapper();

    static final List<Field> DOMAIN_FIELDS = List.of(
        new Field("name", "string"),
        new Field("version", "string"),
        new Field("chainId", "uint256"),
        new Field("verifyingContract", "address"));

    String primaryType;
    List<Field> fields;
    Map<String, Object> domain;
    Map<String, Object> message;

    public Map<String, Object> toTypedData() {
        Map<String, Object> types = new LinkedHashMap<>();
        types.put("EIP712Domain", DOMAIN_FIELDS.stream().map(Field::toMap).collect(Collectors.toList()));
        types.put(primaryType, fields.stream().map(Field::toMap).collect(Collectors.toList()));

        Map<String, Object> typedData = new LinkedHashMap<>();
        typedData.put("types", types);
        typedData.put("primaryType", primaryType);
        typedData.put("domain", domain);
        typedData.put("message", message);
        return typedData;
    }

    public String toJson() {
        try {
            return JSON.writeValueAsString(toTypedData());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize typed data for " + primaryType, e);
        }
    }

    public byte[] digest() {
        try {
            return new StructuredDataEncoder(toJson()).hashStructuredData();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot encode typed data for " + primaryType, e);
        }
    }

    /**
     * One member of an EIP-712 struct.
     */
    @Value
    public static class Field {
        String name;
        String type;

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", name);
            map.put("type", type);
            return map;
        }
    }
}
