package com.scroll.ocr.core.chat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单条消息行的匹配规则
 * <p>
 * 每条规则是一个整行正则，外加说话人、时间戳、正文各自所在的分组号（0 表示没有该分组）。
 */
public final class ChatPattern {
    private static final String SPEAKER = "([A-Z][a-zA-Z\\s]{0,30})";
    private static final String TIME = "([0-9:APM\\s]+)";

    /** "Name: message" */
    public static final ChatPattern NAME_COLON = new ChatPattern("name-colon",
        "^" + SPEAKER + "\\s*:\\s*(.+)$", 1, 0, 2, 30);

    /** "[Time] Name: message" 或 "(Time) Name: message" */
    public static final ChatPattern BRACKET_TIME_NAME_COLON = new ChatPattern("bracket-time-name-colon",
        "^[\\[\\(]" + TIME + "[\\]\\)]\\s*" + SPEAKER + "\\s*:\\s*(.+)$", 2, 1, 3, 0);

    /** "Name [Time]: message" */
    public static final ChatPattern NAME_BRACKET_TIME_COLON = new ChatPattern("name-bracket-time-colon",
        "^" + SPEAKER + "\\s*[\\[\\(]" + TIME + "[\\]\\)]\\s*:\\s*(.+)$", 1, 2, 3, 0);

    /** "HH:MM Name: message" */
    public static final ChatPattern TIME_NAME_COLON = new ChatPattern("time-name-colon",
        "^([0-9]{1,2}:[0-9]{2}\\s*(?:AM|PM)?)\\s+" + SPEAKER + "\\s*:\\s*(.+)$", 2, 1, 3, 0);

    private final String name;
    private final Pattern pattern;
    private final int speakerGroup;
    private final int timestampGroup;
    private final int messageGroup;
    /** 说话人（未 trim）长度须小于该值，0 表示不限制 */
    private final int speakerLengthLimit;

    private ChatPattern(String name, String regex, int speakerGroup, int timestampGroup,
                        int messageGroup, int speakerLengthLimit) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.speakerGroup = speakerGroup;
        this.timestampGroup = timestampGroup;
        this.messageGroup = messageGroup;
        this.speakerLengthLimit = speakerLengthLimit;
    }

    /**
     * 仅判断整行是否符合正则，不做说话人长度检查（用于聊天检测打分）
     */
    public boolean matches(String line) {
        return pattern.matcher(line).matches();
    }

    /**
     * 解析消息行
     *
     * @return 解析出的消息；不匹配或说话人不合法时返回 null
     */
    public ChatMessage parse(String line, int lineNumber) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String speaker = matcher.group(speakerGroup);
        if (speaker.isEmpty() || (speakerLengthLimit > 0 && speaker.length() >= speakerLengthLimit)) {
            return null;
        }
        String timestamp = timestampGroup > 0 ? matcher.group(timestampGroup).trim() : null;
        return new ChatMessage(speaker.trim(), matcher.group(messageGroup).trim(), timestamp, lineNumber);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ChatPattern{" + name + "}";
    }
}
