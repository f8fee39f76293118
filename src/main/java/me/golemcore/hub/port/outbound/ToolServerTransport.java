package me.golemcore.hub.port.outbound;

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

import java.io.Closeable;
import java.io.IOException;

/**
 * Line-oriented message channel to one tool server process or endpoint. The
 * broker owns JSON-RPC framing and request demultiplexing; a transport only
 * moves raw lines.
 */
public interface ToolServerTransport extends Closeable {

    /**
     * Opens the channel. Inbound lines and the close signal are delivered to
     * the listener from a transport-owned thread.
     */
    void open(Listener listener) throws IOException;

    /**
     * Sends one message line. Safe to call from multiple threads.
     */
    void send(String line) throws IOException;

    boolean isOpen();

    @Override
    void close();

    /**
     * Callbacks from the transport reader.
     */
    interface Listener {

        void onMessage(String line);

        /**
         * Called once when the channel ends, with the cause if it ended
         * abnormally.
         */
        void onClosed(Throwable cause);
    }
}
