package com.saurabhshcs.adtech.sagapattern.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Versioned JSON form of a {@link UserSession} as kept by external stores.
 * <p>
 * Layout: {@code {schema_version, session_id, created_at, orders, inventory, balances,
 * saga_transactions}}. Storage format changes stay in this class.
 * </p>
 */
public class SessionCodec {

    public static final int CURRENT_VERSION = 1;
    static final String VERSION_FIELD = "schema_version";

    private final ObjectMapper objectMapper;

    public SessionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encode(UserSession session) {
        try {
            ObjectNode node = objectMapper.valueToTree(session);
            ObjectNode document = objectMapper.createObjectNode();
            document.put(VERSION_FIELD, CURRENT_VERSION);
            document.setAll(node);
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SessionCodecException("Failed to serialize session " + session.getSessionId(), e);
        }
    }

    public UserSession decode(String json) {
        try {
            JsonNode document = objectMapper.readTree(json);
            if (document == null || !document.isObject()) {
                throw new SessionCodecException("Session record is not a JSON object");
            }
            JsonNode version = document.get(VERSION_FIELD);
            if (version == null || !version.canConvertToInt() || version.asInt() != CURRENT_VERSION) {
                throw new SessionCodecException("Unsupported session schema version: " + version);
            }
            ObjectNode body = ((ObjectNode) document).deepCopy();
            body.remove(VERSION_FIELD);
            UserSession session = objectMapper.treeToValue(body, UserSession.class);
            if (session.getSessionId() == null) {
                throw new SessionCodecException("Session record has no session_id");
            }
            return session;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SessionCodecException("Failed to deserialize session", e);
        }
    }
}
