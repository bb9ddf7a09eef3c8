package com.mailmind.priority;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mailmind.exception.MailMindException;

/**
 * JSON form of {@link SenderProfile} as kept in the preference store.
 */
public class SenderProfileCodec {

    static final String KEY_PREFIX = "sender.profile.";

    private final ObjectMapper objectMapper;

    public SenderProfileCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Preference key for a sender key.
     */
    public static String preferenceKey(String senderKey) {
        return KEY_PREFIX + senderKey;
    }

    public String encode(SenderProfile profile) {
        try {
            return objectMapper.writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new MailMindException("Failed to encode profile for " + profile.senderKey(), e);
        }
    }

    public SenderProfile decode(String json) {
        try {
            return objectMapper.readValue(json, SenderProfile.class);
        } catch (JsonProcessingException e) {
            throw new MailMindException("Failed to decode sender profile: " + e.getOriginalMessage(), e);
        }
    }
}
