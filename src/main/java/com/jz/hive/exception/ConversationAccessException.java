package com.jz.hive.exception;

import lombok.Getter;

@Getter
public class ConversationAccessException extends RuntimeException {

    private final int code;

    private ConversationAccessException(int code, String message) {
        super(message);
        this.code = code;
    }

    public static ConversationAccessException notFound(String conversationId) {
        return new ConversationAccessException(404, "Conversation not found: " + conversationId);
    }

    public static ConversationAccessException notMember(String conversationId) {
        return new ConversationAccessException(403, "You are not a member of this conversation: " + conversationId);
    }

    public static ConversationAccessException notAdmin(String conversationId) {
        return new ConversationAccessException(403, "Only admins can remove other members: " + conversationId);
    }

    public static ConversationAccessException alreadyMember(String conversationId) {
        return new ConversationAccessException(409, "Already a member of this conversation: " + conversationId);
    }
}
