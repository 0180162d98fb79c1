package org.example.coach.service.conversation;

public enum ConversationFailure {
    INVALID_SELECTION("Invalid selection. Please use the buttons on the latest message."),
    STORE_UNAVAILABLE("Something went wrong on our side. Please try again later."),
    INTERNAL("Something went wrong. Please try again.");

    private final String userMessage;

    ConversationFailure(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
