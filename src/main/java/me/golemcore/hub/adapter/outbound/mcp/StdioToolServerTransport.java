package me.golemcore.hub.adapter.outbound.mcp;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.port.outbound.ToolServerTransport;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport to a tool server running as a local child process, one JSON-RPC
 * message per line over stdin/stdout.
 *
 * <p>
 * A reader thread delivers stdout lines to the listener and a second thread
 * drains stderr to the DEBUG log. Process exit, or a broken pipe on write, is
 * reported through {@link Listener#onClosed(Throwable)} exactly once.
 */
@Slf4j
public class StdioToolServerTransport implements ToolServerTransport {

    private static final long DESTROY_GRACE_SECONDS = 5;

    private final String name;
    private final String command;
    private final Map<String, String> env;
    private final AtomicBoolean closeReported = new AtomicBoolean();

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;
    private volatile Listener listener;

    public StdioToolServerTransport(String name, String command, Map<String, String> env) {
        this.name = name;
        this.command = command;
        this.env = env;
    }

    @Override
    public void open(Listener listener) throws IOException {
        this.listener = listener;
        log.info("[MCP:{}] Starting server: {}", name, command);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(false);
        if (env != null) {
            pb.environment().putAll(env);
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + name);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public void send(String line) throws IOException {
        BufferedWriter out = writer;
        if (!running || out == null) {
            throw new IOException("Transport to " + name + " is not open");
        }
        try {
            synchronized (out) {
                out.write(line);
                out.newLine();
                out.flush();
            }
        } catch (IOException e) {
            reportClosed(e);
            throw e;
        }
    }

    @Override
    public boolean isOpen() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        if (!running && process == null) {
            return;
        }
        log.debug("[MCP:{}] Closing transport", name);
        running = false;

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing stdin: {}", name, e.getMessage());
            }
        }

        Process p = process;
        if (p != null && p.isAlive()) {
            p.destroy();
            try {
                if (!p.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[MCP:{}] Process did not exit gracefully, forcing", name);
                    p.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                p.destroyForcibly();
            }
        }
        reportClosed(null);
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        Throwable failure = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    listener.onMessage(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", name, e.getMessage());
                failure = e;
            }
        }
        if (running) {
            running = false;
            reportClosed(failure != null ? failure : new IOException("Tool server process exited"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", name, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", name, e.getMessage());
            }
        }
    }

    private void reportClosed(Throwable cause) {
        Listener current = listener;
        if (current != null && closeReported.compareAndSet(false, true)) {
            current.onClosed(cause);
        }
    }
}
