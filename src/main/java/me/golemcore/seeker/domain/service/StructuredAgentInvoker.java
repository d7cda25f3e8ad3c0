/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.seeker.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.AgentRole;
import me.golemcore.seeker.domain.model.ErrorKind;
import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;
import me.golemcore.seeker.domain.model.Message;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.Trace;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.domain.protocol.DecodeError;
import me.golemcore.seeker.domain.protocol.DecodeResult;
import me.golemcore.seeker.domain.protocol.ProtocolCodec;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Invokes an agent and decodes its answer through the {@link ProtocolCodec},
 * with at most one repair re-invocation per call.
 *
 * <p>
 * Repair appends the invalid assistant output and an instruction naming the
 * decode failure to the original conversation. A provider exception is not
 * repaired; it is reported as {@link AgentOutcome.Status#INVOCATION_FAILED}.
 * Every raw output, decoded message and error is written to the run trace.
 */
@Slf4j
public class StructuredAgentInvoker {

    private final LlmPort llmPort;
    private final ProtocolCodec codec;
    private final SeekerProperties.LlmProperties settings;

    public StructuredAgentInvoker(LlmPort llmPort, ProtocolCodec codec, SeekerProperties.LlmProperties settings) {
        this.llmPort = llmPort;
        this.codec = codec;
        this.settings = settings;
    }

    public <T> AgentOutcome<T> invoke(RunContext context, AgentCall<T> call) {
        Trace trace = context.getTrace();
        List<Message> conversation = new ArrayList<>();
        conversation.add(Message.user(call.userPayload()));

        String raw;
        try {
            raw = send(context, call, conversation);
        } catch (RuntimeException e) {
            return invocationFailure(trace, call, e, null, 0);
        }
        recordRaw(trace, call, raw, 0);

        DecodeResult<T> decoded = codec.decode(raw, call.schema());
        if (decoded.isSuccess()) {
            recordMessage(trace, call, decoded.getValue(), 0);
            return AgentOutcome.success(decoded.getValue(), raw, 0);
        }

        DecodeError firstError = decoded.getError();
        recordDecodeError(trace, call, firstError, 0);

        String instruction = AgentPrompts.repairInstruction(firstError.describe(), call.schema().getName());
        trace.record(TraceEventType.REPAIR_REQUESTED, "Repair requested for " + call.stage(),
                data(call, "reason", firstError.describe()));
        log.debug("[LLM] {} output invalid ({}), requesting repair", call.stage(), firstError.describe());
        conversation.add(Message.assistant(raw != null ? raw : ""));
        conversation.add(Message.user(instruction));

        String repaired;
        try {
            repaired = send(context, call, conversation);
        } catch (RuntimeException e) {
            return invocationFailure(trace, call, e, raw, 1);
        }
        recordRaw(trace, call, repaired, 1);

        DecodeResult<T> second = codec.decode(repaired, call.schema());
        if (second.isSuccess()) {
            recordMessage(trace, call, second.getValue(), 1);
            return AgentOutcome.success(second.getValue(), repaired, 1);
        }
        recordDecodeError(trace, call, second.getError(), 1);
        return AgentOutcome.decodeFailed(second.getError(), 1);
    }

    private String send(RunContext context, AgentCall<?> call, List<Message> conversation) {
        boolean planner = call.role() == AgentRole.PLANNER;
        LlmRequest request = LlmRequest.builder()
                .model(planner ? settings.getPlannerModel() : settings.getReaderModel())
                .maxTokens(planner ? settings.getPlannerMaxTokens() : settings.getReaderMaxTokens())
                .temperature(settings.getTemperature())
                .systemPrompt(call.systemPrompt())
                .messages(new ArrayList<>(conversation))
                .runId(context.getRunId())
                .stage(call.stage())
                .build();

        LlmResponse response;
        try {
            response = llmPort.chat(request).join();
        } catch (RuntimeException e) {
            context.getBudget().recordCall(null);
            throw e;
        }
        context.getBudget().recordCall(response != null ? response.getUsage() : null);
        if (response == null) {
            return "";
        }
        return response.getContent() != null ? response.getContent() : "";
    }

    private <T> AgentOutcome<T> invocationFailure(Trace trace, AgentCall<?> call, RuntimeException e,
            String lastRaw, int repairAttempts) {
        String reason = "Agent invocation failed: " + rootMessage(e);
        log.warn("[LLM] {} {}", call.stage(), reason);
        trace.error(ErrorKind.AGENT_INVOCATION_ERROR, reason, data(call, "repairAttempts", repairAttempts));
        return AgentOutcome.invocationFailed(reason, lastRaw, repairAttempts);
    }

    private void recordRaw(Trace trace, AgentCall<?> call, String raw, int attempt) {
        Map<String, Object> data = data(call, "attempt", attempt);
        data.put("raw", raw);
        trace.record(TraceEventType.AGENT_RAW_OUTPUT, "Raw " + call.stage() + " output", data);
    }

    private void recordMessage(Trace trace, AgentCall<?> call, Object message, int attempt) {
        Map<String, Object> data = data(call, "attempt", attempt);
        data.put("message", message);
        trace.record(TraceEventType.AGENT_MESSAGE, "Decoded " + call.schema().getName(), data);
    }

    private void recordDecodeError(Trace trace, AgentCall<?> call, DecodeError error, int attempt) {
        Map<String, Object> data = data(call, "attempt", attempt);
        data.put("reason", error.reason().name());
        data.put("raw", error.rawText());
        trace.error(ErrorKind.DECODE_ERROR, call.stage() + ": " + error.describe(), data);
    }

    private static Map<String, Object> data(AgentCall<?> call, String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("role", call.role().name());
        data.put("stage", call.stage());
        data.put(key, value);
        return data;
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
