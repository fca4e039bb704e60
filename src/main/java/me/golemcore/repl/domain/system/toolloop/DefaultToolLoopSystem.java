package me.golemcore.repl.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.repl.domain.model.AgentTurnResult;
import me.golemcore.repl.domain.model.ConfirmationOutcome;
import me.golemcore.repl.domain.model.ConfirmationState;
import me.golemcore.repl.domain.model.ExecutedToolCall;
import me.golemcore.repl.domain.model.InterruptionProcessingResult;
import me.golemcore.repl.domain.model.LlmAdapterException;
import me.golemcore.repl.domain.model.LlmRequest;
import me.golemcore.repl.domain.model.LlmResponse;
import me.golemcore.repl.domain.model.LlmUsage;
import me.golemcore.repl.domain.model.Message;
import me.golemcore.repl.domain.model.ReplSession;
import me.golemcore.repl.domain.model.ToolDefinition;
import me.golemcore.repl.domain.model.ToolFailureKind;
import me.golemcore.repl.domain.model.ToolResult;
import me.golemcore.repl.domain.model.TurnStopReason;
import me.golemcore.repl.domain.service.SessionService;
import me.golemcore.repl.domain.service.ToolConfirmationGate;
import me.golemcore.repl.infrastructure.config.ReplProperties;
import me.golemcore.repl.port.outbound.LlmPort;
import me.golemcore.repl.port.outbound.ToolRegistryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Agent turn orchestrator.
 *
 * <p>
 * Each iteration: check cancellation, call the LLM with the full conversation
 * and tool catalog, then resolve the requested tool calls one by one through
 * the confirmation gate and the tool registry. The resolved calls are written
 * back as one assistant message of tool-use blocks and one user message of
 * matching tool-result blocks before the next LLM call.
 *
 * <p>
 * Call {@code k+1} never starts before call {@code k} is resolved, so an abort
 * on call {@code k} leaves calls {@code k+1..n} untouched and out of the
 * history. A typed stop request is checked before every call; other typed
 * input is merged at the iteration boundary.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String DECLINED_MESSAGE = "Tool execution was declined by the user";
    static final String DECLINED_REASON = "User declined";

    private static final AbortSignal NEVER_ABORTED = new AbortSignal();

    private final SessionService sessionService;
    private final HistoryWriter historyWriter;
    private final ToolConfirmationGate confirmationGate;
    private final ReplProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DefaultToolLoopSystem(SessionService sessionService, HistoryWriter historyWriter,
            ToolConfirmationGate confirmationGate, ReplProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.sessionService = sessionService;
        this.historyWriter = historyWriter;
        this.confirmationGate = confirmationGate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public AgentTurnResult executeTurn(ReplSession session, String userMessage, LlmPort llmPort,
            ToolRegistryPort toolRegistry, TurnOptions options) {
        TurnOptions turnOptions = options != null ? options : TurnOptions.defaults();
        TurnState turn = new TurnState(turnOptions);
        int maxIterations = properties.getAgent().getMaxToolIterations();
        List<ToolDefinition> tools = toolRegistry.getToolDefinitionsForLlm();

        historyWriter.appendUserMessage(session, userMessage);

        while (turn.iterations < maxIterations) {
            // 1) Cancellation
            if (turn.abortSignal().isAborted()) {
                return turn.aborted(AgentTurnResult.ABORT_REASON_USER_CANCEL);
            }
            turn.iterations++;

            // 2) LLM call
            LlmResponse response = callLlm(session, llmPort, tools, turn);
            turn.usage = turn.usage.plus(response.getUsage());
            if (response.hasContent()) {
                turn.content.append(response.getContent());
                turn.listener().onStream(response.getContent());
            }

            // 3) Final answer
            if (!response.hasToolCalls()) {
                historyWriter.appendFinalAssistantAnswer(session, response.getContent());
                turn.listener().onStreamDone();
                log.debug("[ToolLoop] Turn completed after {} iteration(s)", turn.iterations);
                return turn.finished(TurnStopReason.COMPLETED);
            }

            // 4) Tool calls, strictly in order
            List<ToolExecutionOutcome> outcomes = new ArrayList<>();
            List<Message.ToolCall> toolCalls = response.getToolCalls();
            for (int i = 0; i < toolCalls.size(); i++) {
                Message.ToolCall toolCall = toolCalls.get(i);
                if (turn.abortSignal().isAborted()) {
                    historyWriter.appendToolExchange(session, response.getContent(), outcomes, null);
                    return turn.aborted(AgentTurnResult.ABORT_REASON_USER_CANCEL);
                }
                Optional<InterruptionProcessingResult> stopRequest = pollAbort(turn);
                if (stopRequest.isPresent()) {
                    log.info("[ToolLoop] Stop typed before '{}', skipping {} remaining call(s)",
                            toolCall.getName(), toolCalls.size() - i);
                    turn.listener().onInterruptionsProcessed(stopRequest.get());
                    historyWriter.appendToolExchange(session, response.getContent(), outcomes, null);
                    return turn.aborted(AgentTurnResult.ABORT_REASON_USER_INTERRUPT);
                }

                ConfirmationOutcome decision = confirmationGate.evaluate(session, toolCall, turn.confirmation,
                        turn.options.isSkipConfirmation());
                if (decision == ConfirmationOutcome.ABORTED) {
                    log.info("[ToolLoop] Turn aborted at confirmation of '{}'", toolCall.getName());
                    historyWriter.appendToolExchange(session, response.getContent(), outcomes, null);
                    return turn.aborted(AgentTurnResult.ABORT_REASON_USER_CANCEL);
                }

                ToolExecutionOutcome outcome;
                if (decision.isApproved()) {
                    turn.listener().onToolStart(toolCall, i, toolCalls.size());
                    outcome = executeTool(toolRegistry, toolCall);
                } else {
                    outcome = ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.CONFIRMATION_DENIED,
                            DECLINED_MESSAGE);
                    turn.listener().onToolSkipped(toolCall, DECLINED_REASON);
                }
                outcomes.add(outcome);
                ExecutedToolCall executed = outcome.toExecutedToolCall();
                turn.toolCalls.add(executed);
                if (decision.isApproved()) {
                    turn.listener().onToolEnd(executed);
                }
            }

            // 5) Interruptions typed while the tools ran
            String interruptionContext = null;
            Optional<InterruptionProcessingResult> interruptions = collectInterruptions(turn);
            if (interruptions.isPresent()) {
                InterruptionProcessingResult processed = interruptions.get();
                turn.listener().onInterruptionsProcessed(processed);
                if (processed.shouldAbort()) {
                    historyWriter.appendToolExchange(session, response.getContent(), outcomes, null);
                    return turn.aborted(AgentTurnResult.ABORT_REASON_USER_INTERRUPT);
                }
                interruptionContext = turn.options.getInterruptions().formatContext(processed);
            }

            historyWriter.appendToolExchange(session, response.getContent(), outcomes, interruptionContext);
        }

        log.warn("[ToolLoop] Reached max tool iterations ({}), task may be incomplete", maxIterations);
        turn.listener().onStreamDone();
        return turn.finished(TurnStopReason.MAX_ITERATIONS);
    }

    private LlmResponse callLlm(ReplSession session, LlmPort llmPort, List<ToolDefinition> tools, TurnState turn) {
        LlmRequest request = LlmRequest.builder()
                .messages(sessionService.getConversationContext(session))
                .tools(tools)
                .maxTokens(properties.getProvider().getMaxTokens())
                .sessionId(session.getId())
                .build();

        turn.listener().onThinkingStart();
        try {
            LlmResponse response = llmPort.chatWithTools(request).join();
            if (response == null) {
                throw new LlmAdapterException("LLM adapter returned no response");
            }
            return response;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[ToolLoop] LLM call failed on iteration {}", turn.iterations, cause);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new LlmAdapterException("LLM call failed: " + cause.getMessage(), cause);
        } finally {
            turn.listener().onThinkingEnd();
        }
    }

    private ToolExecutionOutcome executeTool(ToolRegistryPort toolRegistry, Message.ToolCall toolCall) {
        Instant start = clock.instant();
        ToolResult result;
        try {
            result = toolRegistry.execute(toolCall.getName(), toolCall.getArguments()).join();
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("[ToolLoop] Tool '{}' failed", toolCall.getName(), cause);
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + cause.getMessage());
        }
        if (result == null) {
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }
        Duration duration = Duration.between(start, clock.instant());
        return new ToolExecutionOutcome(toolCall, result, renderContent(result), duration);
    }

    private Optional<InterruptionProcessingResult> pollAbort(TurnState turn) {
        if (turn.options.getInterruptions() == null) {
            return Optional.empty();
        }
        return turn.options.getInterruptions().pollAbort();
    }

    private Optional<InterruptionProcessingResult> collectInterruptions(TurnState turn) {
        if (turn.options.getInterruptions() == null) {
            return Optional.empty();
        }
        return turn.options.getInterruptions().collect();
    }

    private String renderContent(ToolResult result) {
        if (!result.isSuccess()) {
            return result.getError() != null ? result.getError() : "Unknown error";
        }
        Object data = result.getData();
        if (data == null || data instanceof String) {
            if (result.getOutput() != null) {
                return result.getOutput();
            }
            return data != null ? (String) data : "";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.debug("[ToolLoop] Tool data not serializable, using output: {}", e.getMessage());
            return result.getOutput() != null ? result.getOutput() : String.valueOf(data);
        }
    }

    /**
     * Mutable accumulators of one turn.
     */
    private static final class TurnState {
        private final TurnOptions options;
        private final ConfirmationState confirmation = ConfirmationState.forTurn();
        private final StringBuilder content = new StringBuilder();
        private final List<ExecutedToolCall> toolCalls = new ArrayList<>();
        private LlmUsage usage = LlmUsage.empty();
        private int iterations;

        private TurnState(TurnOptions options) {
            this.options = options;
        }

        private AgentTurnListener listener() {
            return options.getListener() != null ? options.getListener() : AgentTurnListener.NOOP;
        }

        private AbortSignal abortSignal() {
            return options.getAbortSignal() != null ? options.getAbortSignal() : NEVER_ABORTED;
        }

        private AgentTurnResult aborted(String reason) {
            log.info("[ToolLoop] Turn aborted ({}) after {} tool call(s)", reason, toolCalls.size());
            String partial = content.length() > 0 ? content.toString() : null;
            return AgentTurnResult.builder()
                    .content(content.toString())
                    .toolCalls(List.copyOf(toolCalls))
                    .usage(usage)
                    .aborted(true)
                    .partialContent(partial)
                    .abortReason(reason)
                    .stopReason(TurnStopReason.ABORTED)
                    .iterations(iterations)
                    .build();
        }

        private AgentTurnResult finished(TurnStopReason stopReason) {
            return AgentTurnResult.builder()
                    .content(content.toString())
                    .toolCalls(List.copyOf(toolCalls))
                    .usage(usage)
                    .aborted(false)
                    .stopReason(stopReason)
                    .iterations(iterations)
                    .build();
        }
    }
}
