package com.subagent.gateway.grouping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagent.gateway.Fixtures;
import com.subagent.gateway.completion.CompletionOptions;
import com.subagent.gateway.completion.CompletionProvider;
import com.subagent.gateway.completion.ConversationTurn;
import com.subagent.gateway.grouping.GroupingException.Kind;
import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.ProjectContext;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives ToolGroupingOrchestrator with a scripted completion provider.
 *
 * The provider tells the phases apart by temperature (0.5 analysis,
 * 0.4 strategy, 0.3 final) and answers phase 3 from a queue of replies;
 * the last queued reply repeats once the queue runs dry.
 */
class ToolGroupingOrchestratorTest {

    static final GroupingConstraints SIXTY_TOOL_RULES = new GroupingConstraints(3, 5, 3, 20);

    final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    final ObjectMapper        json   = new ObjectMapper();

    ToolGroupingOrchestrator orchestrator = newOrchestrator(Duration.ofSeconds(5));

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    ToolGroupingOrchestrator newOrchestrator(Duration timeout) {
        return new ToolGroupingOrchestrator(
                new ConstraintValidator(NumericConstraintPolicy.STRICT),
                new GroupingReplyParser(json),
                meters,
                timeout);
    }

    // ------------------------------------------------------------------
    // Input errors
    // ------------------------------------------------------------------

    @Test
    void groupTools_emptyInput_failsWithoutCallingProvider() {
        ScriptedCompletion completion = new ScriptedCompletion("unused");

        assertThatThrownBy(() -> orchestrator.groupTools(List.of(), completion, SIXTY_TOOL_RULES, null))
                .isInstanceOf(GroupingException.class)
                .satisfies(e -> assertThat(((GroupingException) e).getKind()).isEqualTo(Kind.EMPTY_INPUT));
        assertThat(completion.calls).isEmpty();
    }

    @Test
    void groupTools_malformedConstraints_failsWithoutCallingProvider() {
        ScriptedCompletion completion = new ScriptedCompletion("unused");

        assertThatThrownBy(() -> orchestrator.groupTools(Fixtures.tools(5), completion,
                        new GroupingConstraints(4, 2, 1, 3), null))
                .isInstanceOf(GroupingException.class)
                .hasMessageContaining("INVALID_CONSTRAINTS")
                .hasMessageContaining("maxToolsPerGroup");
        assertThat(completion.calls).isEmpty();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void groupTools_sixtyTools_producesValidCoveringPartition() {
        List<Tool> tools = Fixtures.tools(60);
        ScriptedCompletion completion = new ScriptedCompletion(Fixtures.reply(Fixtures.chunks(tools, 4)));

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, SIXTY_TOOL_RULES,
                new ProjectContext("Web development", List.of("keep git tools together"), null));

        assertThat(groups).hasSizeBetween(12, 20);
        assertThat(groups.stream().flatMap(g -> g.toolKeys().stream()).distinct().count()).isEqualTo(60);
        assertThat(completion.calls).hasSize(3);
        assertThat(completion.calls).extracting(CompletionOptions::temperature).containsExactly(0.5, 0.4, 0.3);
        assertThat(completion.calls.get(0).messages().get(1).content()).contains("Web development");
        assertThat(meters.counter("subagents.grouping.attempts", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void groupTools_finalPhase_hasOwnSystemPromptAndSchema() {
        List<Tool> tools = Fixtures.tools(6);
        ScriptedCompletion completion = new ScriptedCompletion(Fixtures.reply(Fixtures.chunks(tools, 2)));

        orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null);

        CompletionOptions analysis = completion.calls.get(0);
        CompletionOptions last     = completion.calls.get(2);
        assertThat(analysis.messages().get(0).content()).isEqualTo(GroupingPrompts.ANALYSIS_SYSTEM);
        assertThat(last.messages().get(0).role()).isEqualTo(ConversationTurn.Role.SYSTEM);
        assertThat(last.messages().get(0).content()).isNotEqualTo(GroupingPrompts.ANALYSIS_SYSTEM);
        assertThat(last.responseSchema()).isEqualTo(GroupingResponseSchema.SCHEMA);
        // system, analysis q/a, strategy q/a, final question
        assertThat(last.messages()).hasSize(6);
    }

    // ------------------------------------------------------------------
    // Inner retry: same conversation, told what was wrong
    // ------------------------------------------------------------------

    @Test
    void groupTools_badReplyThenGood_repairsWithinSameAttempt() {
        List<Tool> tools = Fixtures.tools(6);
        ScriptedCompletion completion = new ScriptedCompletion(
                "not json", Fixtures.reply(Fixtures.chunks(tools, 2)));

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null);

        assertThat(groups).hasSize(3);
        assertThat(completion.calls).hasSize(4);

        List<ConversationTurn> repair = completion.calls.get(3).messages();
        assertThat(repair.get(repair.size() - 2)).isEqualTo(ConversationTurn.assistant("not json"));
        assertThat(repair.get(repair.size() - 1).content())
                .startsWith("Your previous reply could not be accepted:")
                .contains("not valid JSON");
    }

    @Test
    void groupTools_notJsonThreeTimesEveryAttempt_exhaustsWithParseError() {
        List<Tool> tools = Fixtures.tools(6);
        ScriptedCompletion completion = new ScriptedCompletion("not json");

        assertThatThrownBy(() -> orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null))
                .isInstanceOf(GroupingException.class)
                .satisfies(e -> {
                    GroupingException ge = (GroupingException) e;
                    assertThat(ge.getKind()).isEqualTo(Kind.EXHAUSTED);
                    assertThat(ge.getDetail())
                            .startsWith("Failed to generate valid groups after 3 attempts. Last error: ")
                            .contains("not valid JSON");
                });

        // 3 outer attempts x (analysis + strategy + 3 final replies)
        assertThat(completion.calls).hasSize(15);
        // Each outer attempt restarts phase 1 from an empty conversation
        assertThat(completion.calls.get(5).messages()).hasSize(2);
        assertThat(completion.calls.get(10).messages()).hasSize(2);
        assertThat(meters.counter("subagents.grouping.attempts", "outcome", "reply_error").count()).isEqualTo(3.0);
    }

    // ------------------------------------------------------------------
    // Outer retry: decoded but invalid
    // ------------------------------------------------------------------

    @Test
    void groupTools_validationFailure_restartsWithRetryNotice() {
        List<Tool> tools = Fixtures.tools(6);
        // One group of six breaks maxToolsPerGroup=3; the second attempt splits properly.
        ScriptedCompletion completion = new ScriptedCompletion(
                Fixtures.reply(List.of(tools)),
                Fixtures.reply(Fixtures.chunks(tools, 2)));

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null);

        assertThat(groups).hasSize(3);
        assertThat(completion.calls).hasSize(6);
        assertThat(completion.calls.get(5).messages().get(5).content()).contains("RETRY #2");
        assertThat(meters.counter("subagents.grouping.attempts", "outcome", "validation_error").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Completion failures
    // ------------------------------------------------------------------

    @Test
    void groupTools_analysisCallTimesOut_nextAttemptSucceeds() {
        orchestrator.shutdown();
        orchestrator = newOrchestrator(Duration.ofMillis(200));

        List<Tool> tools = Fixtures.tools(6);
        ScriptedCompletion completion = new ScriptedCompletion(Fixtures.reply(Fixtures.chunks(tools, 2)));
        completion.stallFirstAnalysis = true;

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null);

        assertThat(groups).hasSize(3);
        assertThat(meters.counter("subagents.grouping.attempts", "outcome", "completion_error").count()).isEqualTo(1.0);
    }

    @Test
    void groupTools_finalCallThrows_isRetriedInsideAttempt() {
        List<Tool> tools = Fixtures.tools(6);
        ScriptedCompletion completion = new ScriptedCompletion(
                ScriptedCompletion.FAIL, Fixtures.reply(Fixtures.chunks(tools, 2)));

        List<ToolGroup> groups = orchestrator.groupTools(tools, completion, new GroupingConstraints(1, 3, 1, 5), null);

        assertThat(groups).hasSize(3);
        // analysis, strategy, failed final, final again with the unchanged conversation
        assertThat(completion.calls).hasSize(4);
        assertThat(completion.calls.get(3).messages()).isEqualTo(completion.calls.get(2).messages());
    }

    // ------------------------------------------------------------------
    // Scripted provider
    // ------------------------------------------------------------------

    static class ScriptedCompletion implements CompletionProvider {

        static final String FAIL = "<<throw>>";

        final List<CompletionOptions> calls = new CopyOnWriteArrayList<>();
        final Deque<String> finalReplies;
        volatile boolean stallFirstAnalysis;

        ScriptedCompletion(String... finalReplies) {
            this.finalReplies = new ArrayDeque<>(List.of(finalReplies));
        }

        @Override
        public synchronized String complete(String prompt, CompletionOptions options) {
            calls.add(options);
            double t = options.temperature();
            if (t == 0.5) {
                if (stallFirstAnalysis) {
                    stallFirstAnalysis = false;
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                }
                return "The tools cluster around files, git and search.";
            }
            if (t == 0.4) {
                return "Plan: one group per cluster.";
            }
            String reply = finalReplies.size() > 1 ? finalReplies.poll() : finalReplies.peek();
            if (FAIL.equals(reply)) {
                throw new IllegalStateException("provider unavailable");
            }
            return reply;
        }
    }
}
