package com.scroll.ocr.core.chat;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话统计：消息总数、参与者（按首次出现顺序）及各自的消息数
 */
@Getter
@ToString
public class ConversationSummary {
    private final int totalMessages;
    private final List<String> participants;
    private final Map<String, Integer> messageCountByParticipant;
    private final boolean hasTimestamps;

    private ConversationSummary(int totalMessages, List<String> participants,
                                Map<String, Integer> messageCountByParticipant, boolean hasTimestamps) {
        this.totalMessages = totalMessages;
        this.participants = Collections.unmodifiableList(participants);
        this.messageCountByParticipant = Collections.unmodifiableMap(messageCountByParticipant);
        this.hasTimestamps = hasTimestamps;
    }

    public static ConversationSummary of(List<ChatMessage> messages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        boolean timestamps = false;
        for (ChatMessage message : messages) {
            counts.merge(message.getSpeaker(), 1, Integer::sum);
            if (message.getTimestamp() != null && !message.getTimestamp().isEmpty()) {
                timestamps = true;
            }
        }
        return new ConversationSummary(messages.size(), new ArrayList<>(counts.keySet()), counts, timestamps);
    }
}
