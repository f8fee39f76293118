package me.golemcore.hub.domain.context;

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

import me.golemcore.hub.domain.model.Turn;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * One line per turn: role and the first sentence of the content. When the
 * lines exceed the character cap, the oldest are dropped and replaced by a
 * count.
 */
@Component
public class RollingConversationSummarizer implements ConversationSummarizer {

    private static final int MAX_LINE_CHARS = 160;

    @Override
    public String summarize(List<Turn> turns, int maxChars) {
        if (turns == null || turns.isEmpty() || maxChars <= 0) {
            return "";
        }
        Deque<String> kept = new ArrayDeque<>();
        int used = 0;
        int omitted = 0;
        for (int i = turns.size() - 1; i >= 0; i--) {
            String line = line(turns.get(i));
            if (used + line.length() + 1 > maxChars) {
                omitted = i + 1;
                break;
            }
            kept.addFirst(line);
            used += line.length() + 1;
        }
        StringBuilder sb = new StringBuilder();
        if (omitted > 0) {
            sb.append("(").append(omitted).append(" earlier turn(s) omitted)\n");
        }
        sb.append(String.join("\n", kept));
        return sb.toString().trim();
    }

    private static String line(Turn turn) {
        String content = turn.getContent() != null ? turn.getContent().strip() : "";
        String sentence = firstSentence(content);
        if (sentence.length() > MAX_LINE_CHARS) {
            sentence = sentence.substring(0, MAX_LINE_CHARS - 3) + "...";
        }
        return "- " + turn.getRole() + ": " + sentence;
    }

    private static String firstSentence(String content) {
        int newline = content.indexOf('\n');
        String firstLine = newline >= 0 ? content.substring(0, newline) : content;
        for (int i = 0; i < firstLine.length() - 1; i++) {
            char c = firstLine.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(firstLine.charAt(i + 1))) {
                return firstLine.substring(0, i + 1);
            }
        }
        return firstLine;
    }
}
