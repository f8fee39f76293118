package me.golemcore.hub.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.exception.HubException;
import me.golemcore.hub.domain.exception.ToolInvocationException;
import me.golemcore.hub.domain.model.ActionKind;
import me.golemcore.hub.domain.model.ConnectionHandle;
import me.golemcore.hub.domain.model.ProposedAction;
import me.golemcore.hub.domain.model.ToolResult;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Dispatches a {@link ProposedAction} by kind and runs its post-action check.
 * Blocks the calling task thread until the tool call finishes or times out,
 * so a cancelled task never abandons a call mid-flight.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActionExecutor {

    private final ToolServerBroker broker;
    private final ModelInvoker modelInvoker;
    private final HubProperties properties;

    public ToolResult execute(ProposedAction action) {
        log.info("[Loop] Executing {}", action.describe());
        return switch (action.getKind()) {
        case PROMPT -> ToolResult.success(
                modelInvoker.completeText(properties.getContext().getSystemPrompt(), action.getPrompt()));
        case SCRIPT -> runScript(action);
        case TOOL_CALL -> await(action.getToolName(),
                broker.invokeTool(action.getToolName(), action.getArguments(), invokeTimeout()));
        };
    }

    /**
     * Checks the outcome of an executed action. A failed result never passes;
     * when the action carries a verification call, that call must succeed too.
     */
    public boolean verify(ProposedAction action, ToolResult result) {
        if (result == null || !result.isSuccess()) {
            return false;
        }
        ProposedAction verification = action.getVerification();
        if (verification == null) {
            return true;
        }
        if (verification.getKind() != ActionKind.TOOL_CALL) {
            log.warn("[Loop] Ignoring non-tool verification step: {}", verification.describe());
            return true;
        }
        ToolResult check = await(verification.getToolName(),
                broker.invokeTool(verification.getToolName(), verification.getArguments(), invokeTimeout()));
        log.debug("[Loop] Verification {} -> success={}", verification.getToolName(), check.isSuccess());
        return check.isSuccess();
    }

    private ToolResult runScript(ProposedAction action) {
        HubProperties.ScriptToolProperties scriptTool = properties.getAutonomy().getScriptTool();
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("language", action.getLanguage() != null ? action.getLanguage() : "sh");
        arguments.put("script", action.getScript());
        String toolName = scriptTool.getName();
        if (scriptTool.getServer() == null || scriptTool.getServer().isBlank()) {
            return await(toolName, broker.invokeTool(toolName, arguments, invokeTimeout()));
        }
        ConnectionHandle handle = broker.findHandle(scriptTool.getServer())
                .orElseThrow(() -> ToolInvocationException.fatal(toolName,
                        "Script server not connected: " + scriptTool.getServer()));
        return await(toolName, broker.invoke(handle, toolName, arguments, invokeTimeout()));
    }

    private Duration invokeTimeout() {
        return Duration.ofMillis(properties.getBroker().getDefaultInvokeTimeoutMs());
    }

    private static ToolResult await(String toolName, CompletableFuture<ToolResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HubException hubException) {
                throw hubException;
            }
            throw ToolInvocationException.transientFailure(toolName, cause.getMessage(), cause);
        }
    }
}
