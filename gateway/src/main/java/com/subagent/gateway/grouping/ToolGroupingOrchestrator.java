package com.subagent.gateway.grouping;

import com.subagent.gateway.completion.CompletionOptions;
import com.subagent.gateway.completion.CompletionProvider;
import com.subagent.gateway.completion.Conversation;
import com.subagent.gateway.completion.ConversationTurn;
import com.subagent.gateway.grouping.GroupingException.Kind;
import com.subagent.gateway.model.GroupingConstraints;
import com.subagent.gateway.model.ProjectContext;
import com.subagent.gateway.model.Tool;
import com.subagent.gateway.model.ToolGroup;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the LLM conversation that splits a tool catalog into groups.
 *
 * Each outer attempt runs three phases from scratch:
 * <pre>
 *   1. analysis: free-text characterisation of the project and tool clusters
 *   2. strategy: free-text plan that respects the numeric constraints
 *   3. final: strict JSON assignment, decoded by {@link GroupingReplyParser}
 * </pre>
 * Phase 3 has its own inner loop: a rejected reply is answered in the same
 * conversation with the exact reason, so formatting slips are fixed without
 * redoing the analysis. A decoded partition that fails
 * {@link ConstraintValidator} is a strategic problem and costs a whole new
 * outer attempt.
 *
 * All retry state is local to {@link #groupTools}; the orchestrator itself
 * is stateless and safe to share between concurrent build runs.
 */
@Component
public class ToolGroupingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ToolGroupingOrchestrator.class);

    static final int MAX_ATTEMPTS       = 3;
    static final int MAX_REPLY_ATTEMPTS = 3;

    private static final double ANALYSIS_TEMPERATURE = 0.5;
    private static final double STRATEGY_TEMPERATURE = 0.4;
    private static final double FINAL_TEMPERATURE    = 0.3;

    private final ConstraintValidator validator;
    private final GroupingReplyParser parser;
    private final MeterRegistry       meterRegistry;
    private final Duration            completionTimeout;

    // Only used to put a deadline on each blocking completion call.
    private final ExecutorService completionPool = Executors.newCachedThreadPool(daemonThreads());

    @Autowired
    public ToolGroupingOrchestrator(ConstraintValidator validator,
                                    GroupingReplyParser parser,
                                    MeterRegistry meterRegistry,
                                    @Value("${subagents.grouping.completion-timeout:PT2M}") Duration completionTimeout) {
        this.validator         = validator;
        this.parser            = parser;
        this.meterRegistry     = meterRegistry;
        this.completionTimeout = completionTimeout;
    }

    @PreDestroy
    public void shutdown() {
        completionPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Partition {@code tools} into validated groups.
     *
     * @param context optional project knowledge for the analysis phase; may be null
     * @throws GroupingException EMPTY_INPUT or INVALID_CONSTRAINTS before any
     *                           completion call, EXHAUSTED after the last attempt
     */
    public List<ToolGroup> groupTools(List<Tool> tools,
                                      CompletionProvider completion,
                                      GroupingConstraints constraints,
                                      ProjectContext context) {
        if (tools == null || tools.isEmpty()) {
            throw new GroupingException(Kind.EMPTY_INPUT, "Cannot create groups from empty tool list");
        }
        List<String> constraintErrors = validator.checkConstraints(constraints);
        if (!constraintErrors.isEmpty()) {
            throw new GroupingException(Kind.INVALID_CONSTRAINTS, String.join("; ", constraintErrors));
        }
        // Tools may be placed in several groups, so tools.size() < minGroups * minToolsPerGroup
        // is not an error here.

        log.info("Grouping {} tools: {}-{} groups, {}-{} tools per group (numeric policy {})",
                tools.size(), constraints.minGroups(), constraints.maxGroups(),
                constraints.minToolsPerGroup(), constraints.maxToolsPerGroup(), validator.policy());

        Timer.Sample sample = Timer.start(meterRegistry);
        String lastError = null;
        try {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                MDC.put("attempt", String.valueOf(attempt));
                try {
                    List<ToolGroup> groups = runDialog(tools, completion, constraints, context, attempt);

                    ValidationResult validation = validator.validate(groups, constraints);
                    if (validation.valid()) {
                        countAttempt("success");
                        log.info("Grouping succeeded on attempt {}/{} with {} groups",
                                attempt, MAX_ATTEMPTS, groups.size());
                        return groups;
                    }
                    lastError = "Generated groups failed validation: " + String.join(", ", validation.errors());
                    countAttempt("validation_error");

                } catch (GroupingException e) {
                    if (e.getKind() == Kind.INTERRUPTED) {
                        throw e;
                    }
                    lastError = e.getDetail();
                    countAttempt(e.getKind() == Kind.COMPLETION_FAILED ? "completion_error" : "reply_error");
                }
                log.warn("Grouping attempt {}/{} failed: {}", attempt, MAX_ATTEMPTS, lastError);
            }
        } finally {
            MDC.remove("attempt");
            sample.stop(meterRegistry.timer("subagents.grouping.duration"));
        }

        throw new GroupingException(Kind.EXHAUSTED,
                "Failed to generate valid groups after %d attempts. Last error: %s"
                        .formatted(MAX_ATTEMPTS, lastError));
    }

    // ------------------------------------------------------------------
    // One outer attempt
    // ------------------------------------------------------------------

    private List<ToolGroup> runDialog(List<Tool> tools,
                                      CompletionProvider completion,
                                      GroupingConstraints constraints,
                                      ProjectContext context,
                                      int attempt) {
        // Phase 1
        log.info("Phase 1/3: analysing project context and tools");
        String analysisPrompt = GroupingPrompts.analysisPrompt(tools, context);
        Conversation conversation = Conversation.empty()
                .append(ConversationTurn.system(GroupingPrompts.ANALYSIS_SYSTEM))
                .append(ConversationTurn.user(analysisPrompt));
        String analysis = ask(completion, analysisPrompt,
                CompletionOptions.of(conversation, ANALYSIS_TEMPERATURE));
        conversation = conversation.append(ConversationTurn.assistant(analysis));

        // Phase 2
        log.info("Phase 2/3: developing grouping strategy");
        String strategyPrompt = GroupingPrompts.strategyPrompt(tools, constraints);
        conversation = conversation.append(ConversationTurn.user(strategyPrompt));
        String strategy = ask(completion, strategyPrompt,
                CompletionOptions.of(conversation, STRATEGY_TEMPERATURE));
        conversation = conversation.append(ConversationTurn.assistant(strategy));

        // Phase 3
        log.info("Phase 3/3: generating final tool groups");
        return finalAssignment(tools, completion, constraints, conversation, attempt);
    }

    /**
     * Ask for the JSON assignment, feeding each rejection back into the same
     * conversation until a reply decodes or the inner budget runs out.
     */
    private List<ToolGroup> finalAssignment(List<Tool> tools,
                                            CompletionProvider completion,
                                            GroupingConstraints constraints,
                                            Conversation analysed,
                                            int attempt) {
        String prompt = GroupingPrompts.finalPrompt(tools, constraints, attempt);
        Conversation conversation = analysed
                .withSystem(GroupingPrompts.finalSystemPrompt(tools, constraints))
                .append(ConversationTurn.user(prompt));

        GroupingException lastFailure = null;
        for (int replyAttempt = 1; replyAttempt <= MAX_REPLY_ATTEMPTS; replyAttempt++) {
            if (replyAttempt > 1) {
                log.info("Phase 3 retry {}/{}: asking for a corrected reply", replyAttempt, MAX_REPLY_ATTEMPTS);
            }

            String reply;
            try {
                reply = ask(completion, conversation.lastContent(),
                        CompletionOptions.of(conversation, FINAL_TEMPERATURE)
                                .withResponseSchema(GroupingResponseSchema.SCHEMA));
            } catch (GroupingException e) {
                if (e.getKind() != Kind.COMPLETION_FAILED) throw e;
                // No reply to correct; ask the same question again.
                lastFailure = e;
                log.warn("Phase 3 attempt {}/{} failed: {}", replyAttempt, MAX_REPLY_ATTEMPTS, e.getDetail());
                continue;
            }

            ReplyDecodeResult decoded = parser.decode(reply, tools);
            if (decoded.isSuccess()) {
                return decoded.groups();
            }

            lastFailure = new GroupingException(Kind.REPLY_REJECTED, decoded.error());
            log.warn("Phase 3 attempt {}/{} rejected: {}", replyAttempt, MAX_REPLY_ATTEMPTS, decoded.error());
            conversation = conversation
                    .append(ConversationTurn.assistant(reply))
                    .append(ConversationTurn.user(GroupingPrompts.correctionPrompt(decoded.error())));
        }
        throw lastFailure;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** One completion call under the configured deadline. */
    private String ask(CompletionProvider completion, String prompt, CompletionOptions options) {
        Future<String> future = completionPool.submit(() -> completion.complete(prompt, options));
        try {
            String reply = future.get(completionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return reply == null ? "" : reply;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GroupingException(Kind.COMPLETION_FAILED,
                    "Completion call timed out after " + completionTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new GroupingException(Kind.COMPLETION_FAILED,
                    "Completion call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GroupingException(Kind.INTERRUPTED, "Interrupted while waiting for completion", e);
        }
    }

    private void countAttempt(String outcome) {
        meterRegistry.counter("subagents.grouping.attempts", "outcome", outcome).increment();
    }

    private static java.util.concurrent.ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "grouping-completion-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
