package org.example.coach.service.gateway;

/**
 * Thrown when the chat transport rejects or fails a delivery.
 */
public class MessagingGatewayException extends RuntimeException {

    public MessagingGatewayException(String message) {
        super(message);
    }

    public MessagingGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
