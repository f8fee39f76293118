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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.domain.model.AgentSession;
import me.golemcore.hub.domain.model.AutonomyTask;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs autonomy tasks: one at a time per session, in submission order, and
 * concurrently across sessions.
 */
@Service
@Slf4j
public class TaskRunCoordinator {

    private static final int MAX_QUEUED_TASKS_PER_SESSION = 100;

    private final AutonomyLoopController loopController;
    private final ExecutorService taskRunExecutor;

    private final Map<String, SessionRunner> runners = new ConcurrentHashMap<>();

    public TaskRunCoordinator(AutonomyLoopController loopController,
            @Qualifier("taskRunExecutor") ExecutorService taskRunExecutor) {
        this.loopController = loopController;
        this.taskRunExecutor = taskRunExecutor;
    }

    public void submit(AgentSession session, AutonomyTask task) {
        // a runner that went idle between lookup and enqueue is already out of the map
        while (!runners.computeIfAbsent(session.getId(), SessionRunner::new).enqueue(session, task)) {
            log.debug("[Loop] Session {} runner retired during submit, retrying", session.getId());
        }
    }

    public boolean isRunning(String sessionId) {
        SessionRunner runner = runners.get(sessionId);
        return runner != null && runner.isBusy();
    }

    private final class SessionRunner {

        private final String sessionId;
        private final Object lock = new Object();
        private final Deque<AutonomyTask> queuedTasks = new ArrayDeque<>();

        private AgentSession session;
        private Future<?> runningTask;
        private boolean retired;

        private SessionRunner(String sessionId) {
            this.sessionId = sessionId;
        }

        /**
         * Returns {@code false} when this runner has retired and the task must
         * go to a fresh one.
         */
        boolean enqueue(AgentSession target, AutonomyTask task) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                session = target;
                if (isRunning()) {
                    if (queuedTasks.size() >= MAX_QUEUED_TASKS_PER_SESSION) {
                        throw new IllegalStateException("Too many queued tasks for session " + sessionId);
                    }
                    queuedTasks.addLast(task);
                    log.info("[Loop] Session {} busy, queued task {} ({} waiting)", sessionId, task.getId(),
                            queuedTasks.size());
                    return true;
                }
                startRun(task);
                return true;
            }
        }

        boolean isBusy() {
            synchronized (lock) {
                return isRunning() || !queuedTasks.isEmpty();
            }
        }

        private boolean isRunning() {
            return runningTask != null && !runningTask.isDone();
        }

        private void startRun(AutonomyTask task) {
            AgentSession target = session;
            runningTask = taskRunExecutor.submit(() -> {
                try {
                    loopController.run(target, task);
                } catch (Exception e) { // NOSONAR - must not kill executor thread
                    log.error("[Loop] Session {} run failed: {}", sessionId, e.getMessage(), e);
                } finally {
                    onRunComplete();
                }
            });
        }

        private void onRunComplete() {
            synchronized (lock) {
                runningTask = null;
                AutonomyTask next = queuedTasks.pollFirst();
                if (next != null) {
                    if (session.isCancelRequested()) {
                        // a cancel aborts the running task only; queued tasks start fresh
                        session.setCancelRequested(false);
                    }
                    startRun(next);
                    return;
                }
                retired = true;
                runners.remove(sessionId, this);
            }
        }
    }
}
