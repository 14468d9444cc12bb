package com.scroll.ocr.core.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 聊天记录检测与格式化
 * <p>
 * 消息行按固定优先级依次尝试 {@link #MESSAGE_PATTERNS}，第一个命中的规则生效。
 * 所有规则都不命中、且当前已有打开的消息时，该行作为上一条消息的续行追加
 * （形如 "Name:" 开头的行除外）。
 */
@Component
public class ChatDetector {
    private static final Logger logger = LoggerFactory.getLogger(ChatDetector.class);

    /** 消息解析规则（按优先级） */
    public static final List<ChatPattern> MESSAGE_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        ChatPattern.NAME_COLON,
        ChatPattern.BRACKET_TIME_NAME_COLON,
        ChatPattern.NAME_BRACKET_TIME_COLON,
        ChatPattern.TIME_NAME_COLON
    ));

    // 检测打分只用最常见的前三种
    private static final int DETECTION_PATTERN_COUNT = 3;

    private static final List<Pattern> TIME_PATTERNS = Arrays.asList(
        Pattern.compile("\\b([0-9]{1,2}:[0-9]{2}\\s*(?:AM|PM)?)\\b"),
        Pattern.compile("\\b([0-9]{1,2}:[0-9]{2}:[0-9]{2})\\b")
    );

    private static final Pattern SPEAKER_PREFIX = Pattern.compile("^[A-Z][a-zA-Z\\s]*:");

    private static final int MIN_LINES = 3;
    private static final double CHAT_RATIO = 0.3;
    private static final String RULE = "=".repeat(60);

    /**
     * 判断文本是否像聊天记录：超过 30% 的非空行带有消息格式或时间戳
     */
    public boolean isLikelyChat(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (!stripped.isEmpty()) {
                lines.add(stripped);
            }
        }

        if (lines.size() < MIN_LINES) {
            return false;
        }

        double indicators = 0;
        for (String line : lines) {
            for (int i = 0; i < DETECTION_PATTERN_COUNT; i++) {
                if (MESSAGE_PATTERNS.get(i).matches(line)) {
                    indicators += 1;
                    break;
                }
            }
            for (Pattern timePattern : TIME_PATTERNS) {
                if (timePattern.matcher(line).find()) {
                    indicators += 0.5;
                    break;
                }
            }
        }

        double confidence = indicators / lines.size();
        logger.debug("Chat confidence: {} ({} lines)", String.format("%.2f", confidence), lines.size());
        return confidence > CHAT_RATIO;
    }

    /**
     * 按行解析消息
     */
    public List<ChatMessage> extractMessages(String text) {
        String[] lines = text.split("\n", -1);
        List<ChatMessage> messages = new ArrayList<>();
        ChatMessage current = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }

            ChatMessage parsed = null;
            for (ChatPattern pattern : MESSAGE_PATTERNS) {
                parsed = pattern.parse(line, i);
                if (parsed != null) {
                    break;
                }
            }

            if (parsed != null) {
                messages.add(parsed);
                current = parsed;
            } else if (current != null && !SPEAKER_PREFIX.matcher(line).lookingAt()) {
                current.setMessage(current.getMessage() + "\n" + line);
            }
        }
        return messages;
    }

    public String formatConversation(List<ChatMessage> messages) {
        return formatConversation(messages, true);
    }

    /**
     * 格式化为可读的会话文本
     */
    public String formatConversation(List<ChatMessage> messages, boolean includeTimestamps) {
        if (messages.isEmpty()) {
            return "";
        }

        List<String> out = new ArrayList<>();
        out.add(RULE);
        out.add("CHAT CONVERSATION");
        out.add(RULE);
        out.add("");

        for (ChatMessage msg : messages) {
            if (includeTimestamps && msg.getTimestamp() != null && !msg.getTimestamp().isEmpty()) {
                out.add("[" + msg.getTimestamp() + "] " + msg.getSpeaker() + ":");
            } else {
                out.add(msg.getSpeaker() + ":");
            }
            for (String bodyLine : msg.getMessage().split("\n", -1)) {
                out.add("  " + bodyLine);
            }
            out.add("");
        }

        out.add(RULE);
        out.add("Total messages: " + messages.size());
        out.add(RULE);
        return String.join("\n", out);
    }

    public ConversationSummary summarize(List<ChatMessage> messages) {
        return ConversationSummary.of(messages);
    }

    /**
     * 检测并格式化；不是聊天或解析不出消息时原样返回
     */
    public ChatProcessingResult processText(String text) {
        if (!isLikelyChat(text)) {
            return ChatProcessingResult.notChat(text);
        }

        List<ChatMessage> messages = extractMessages(text);
        if (messages.isEmpty()) {
            return ChatProcessingResult.notChat(text);
        }

        ConversationSummary summary = summarize(messages);
        String header = "Detected chat conversation with " + summary.getTotalMessages() + " messages\n"
            + "Participants: " + String.join(", ", summary.getParticipants()) + "\n\n";
        logger.info("Chat conversation detected: {} messages, {} participants",
            summary.getTotalMessages(), summary.getParticipants().size());
        return ChatProcessingResult.chat(header + formatConversation(messages), messages, summary);
    }
}
