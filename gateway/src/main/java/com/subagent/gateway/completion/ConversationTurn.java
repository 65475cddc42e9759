package com.subagent.gateway.completion;

/**
 * One message of a completion conversation.
 */
public record ConversationTurn(Role role, String content) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public static ConversationTurn system(String content)    { return new ConversationTurn(Role.SYSTEM, content); }
    public static ConversationTurn user(String content)      { return new ConversationTurn(Role.USER, content); }
    public static ConversationTurn assistant(String content) { return new ConversationTurn(Role.ASSISTANT, content); }
}
