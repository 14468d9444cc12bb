package com.scroll.ocr.core.chat;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 聊天检测结果
 * <p>
 * 检测到聊天时 text 为格式化后的会话，否则为原文。
 */
@Getter
public class ChatProcessingResult {
    private final boolean chatDetected;
    private final String text;
    private final List<ChatMessage> messages;
    /** 未检测到聊天时为 null */
    private final ConversationSummary summary;

    private ChatProcessingResult(boolean chatDetected, String text,
                                 List<ChatMessage> messages, ConversationSummary summary) {
        this.chatDetected = chatDetected;
        this.text = text;
        this.messages = Collections.unmodifiableList(messages);
        this.summary = summary;
    }

    public static ChatProcessingResult chat(String formatted, List<ChatMessage> messages, ConversationSummary summary) {
        return new ChatProcessingResult(true, formatted, messages, summary);
    }

    public static ChatProcessingResult notChat(String original) {
        return new ChatProcessingResult(false, original, Collections.emptyList(), null);
    }
}
