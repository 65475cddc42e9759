package com.subagent.gateway.completion;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, ordered list of turns.
 *
 * Every mutation returns a new instance, so a retry can branch from a saved
 * prefix without seeing what a failed attempt appended.
 */
public final class Conversation {

    private static final Conversation EMPTY = new Conversation(List.of());

    private final List<ConversationTurn> turns;

    private Conversation(List<ConversationTurn> turns) {
        this.turns = turns;
    }

    public static Conversation empty() {
        return EMPTY;
    }

    public Conversation append(ConversationTurn turn) {
        List<ConversationTurn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return new Conversation(List.copyOf(next));
    }

    /**
     * Replace the leading system turn, or insert one when the conversation
     * does not start with a system turn.
     */
    public Conversation withSystem(String content) {
        List<ConversationTurn> next = new ArrayList<>(turns);
        if (!next.isEmpty() && next.get(0).role() == ConversationTurn.Role.SYSTEM) {
            next.set(0, ConversationTurn.system(content));
        } else {
            next.add(0, ConversationTurn.system(content));
        }
        return new Conversation(List.copyOf(next));
    }

    public List<ConversationTurn> turns() {
        return turns;
    }

    public int size() {
        return turns.size();
    }

    /** Content of the last turn, or null when empty. */
    public String lastContent() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1).content();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Conversation)) return false;
        return turns.equals(((Conversation) o).turns);
    }

    @Override
    public int hashCode() {
        return turns.hashCode();
    }

    @Override
    public String toString() {
        return "Conversation" + turns;
    }
}
