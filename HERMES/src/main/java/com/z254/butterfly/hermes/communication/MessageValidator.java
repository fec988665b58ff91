package com.z254.butterfly.hermes.communication;

import com.z254.butterfly.hermes.domain.model.BaseMessage;
import com.z254.butterfly.hermes.domain.model.MessageHeader;
import org.springframework.stereotype.Component;

/**
 * Structural checks applied to every message before dispatch.
 */
@Component
public class MessageValidator {

    /**
     * @throws InvalidMessageException naming the first missing field
     */
    public void validate(BaseMessage message) {
        if (message == null || message.getHeader() == null) {
            throw new InvalidMessageException("Message header is required");
        }
        MessageHeader header = message.getHeader();
        requireText(header.getMessageId(), "messageId");
        requireText(header.getSource(), "source");
        requireText(header.getTarget(), "target");
        requireText(header.getOperation(), "operation");
        if (header.getMessageType() == null) {
            throw new InvalidMessageException("Message is missing messageType");
        }
    }

    private void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidMessageException("Message is missing " + field);
        }
    }

    public static class InvalidMessageException extends RuntimeException {
        public InvalidMessageException(String message) {
            super(message);
        }

        public InvalidMessageException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
