package com.subagent.gateway.completion;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationTest {

    @Test
    void append_returnsNewInstanceAndLeavesOriginalUntouched() {
        Conversation base = Conversation.empty().append(ConversationTurn.user("hi"));

        Conversation branch = base.append(ConversationTurn.assistant("hello"));

        assertThat(base.size()).isEqualTo(1);
        assertThat(branch.size()).isEqualTo(2);
        assertThat(branch.lastContent()).isEqualTo("hello");
        assertThat(Conversation.empty().size()).isZero();
    }

    @Test
    void withSystem_replacesLeadingSystemTurn() {
        Conversation c = Conversation.empty()
                .append(ConversationTurn.system("old"))
                .append(ConversationTurn.user("q"));

        Conversation replaced = c.withSystem("new");

        assertThat(replaced.turns()).containsExactly(ConversationTurn.system("new"), ConversationTurn.user("q"));
        assertThat(c.turns().get(0).content()).isEqualTo("old");
    }

    @Test
    void withSystem_insertsWhenMissing() {
        Conversation c = Conversation.empty().append(ConversationTurn.user("q")).withSystem("sys");

        assertThat(c.turns()).containsExactly(ConversationTurn.system("sys"), ConversationTurn.user("q"));
    }

    @Test
    void equality_isByTurns() {
        Conversation a = Conversation.empty().append(ConversationTurn.user("x"));
        Conversation b = Conversation.empty().append(ConversationTurn.user("x"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(Conversation.empty().lastContent()).isNull();
    }
}
