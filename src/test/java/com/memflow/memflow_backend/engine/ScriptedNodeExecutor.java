package com.memflow.memflow_backend.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.memflow.memflow_backend.executor.NodeExecutionContext;
import com.memflow.memflow_backend.executor.NodeExecutor;
import com.memflow.memflow_backend.executor.WorkflowNode;
import com.memflow.memflow_backend.model.config.NodeConfig;
import com.memflow.memflow_backend.model.workflow.NodeType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stand-in for a remote-calling node, registered under the {@code agent} tag. Its config
 * decides whether it echoes, streams, fails or hangs. A {@code stubborn} node sleeps through
 * interrupts and then tries to write {@code conv.late}, emit a chunk and record a tool error.
 */
class ScriptedNodeExecutor implements NodeExecutor<ScriptedNodeExecutor.ScriptConfig> {

    final AtomicBoolean interrupted = new AtomicBoolean();
    final CountDownLatch stubbornDone = new CountDownLatch(1);
    final AtomicReference<RuntimeException> lateWriteFailure = new AtomicReference<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScriptConfig implements NodeConfig {
        private String mode = "echo";
        private String text = "";
        private List<String> chunks = new ArrayList<>();
        private long sleepMs;

        @Override
        public void validate() {
        }
    }

    @Override
    public NodeType supportedType() {
        return NodeType.AGENT;
    }

    @Override
    public Class<ScriptConfig> configType() {
        return ScriptConfig.class;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public Object execute(WorkflowNode<ScriptConfig> node, NodeExecutionContext ctx) {
        ScriptConfig config = node.getConfig();
        switch (config.getMode()) {
            case "fail" -> throw new IllegalStateException(config.getText());
            case "sleep" -> {
                try {
                    Thread.sleep(config.getSleepMs());
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
                return config.getText();
            }
            case "stubborn" -> {
                sleepIgnoringInterrupts(config.getSleepMs());
                try {
                    ctx.emitChunk("late chunk");
                    ctx.recordToolError("agent", "late error");
                    ctx.getPool().set("conv.late", config.getText());
                } catch (RuntimeException e) {
                    lateWriteFailure.set(e);
                } finally {
                    stubbornDone.countDown();
                }
                return config.getText();
            }
            case "stream" -> {
                config.getChunks().forEach(ctx::emitChunk);
                return String.join("", config.getChunks());
            }
            default -> {
                return config.getText();
            }
        }
    }

    private void sleepIgnoringInterrupts(long millis) {
        long deadline = System.currentTimeMillis() + millis;
        long remaining;
        while ((remaining = deadline - System.currentTimeMillis()) > 0) {
            try {
                Thread.sleep(remaining);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        }
    }
}
