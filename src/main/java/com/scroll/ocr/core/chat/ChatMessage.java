package com.scroll.ocr.core.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条聊天消息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {
    private String speaker;
    /** 消息正文，续行以换行拼接 */
    private String message;
    /** 原文中的时间戳，没有时为 null */
    private String timestamp;
    /** 在原始文本中的行号（从 0 开始，含空行） */
    private int lineNumber;
}
