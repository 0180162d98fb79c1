package org.example.coach.service.gateway;

import org.example.coach.service.conversation.OutboundView;

/**
 * Outbound side of the chat transport.
 */
public interface MessagingGateway {

    /**
     * Delivers a view as a new message.
     */
    void sendView(long userId, OutboundView view);

    /**
     * Replaces the user's current message with the view. Implementations fall back to
     * {@link #sendView} when the transport refuses the edit.
     */
    void editCurrentView(long userId, OutboundView view);

    /**
     * Tells the transport a button press was received so the client stops waiting on it.
     */
    void acknowledgeButton(String callbackId);

    String getGatewayName();
}
