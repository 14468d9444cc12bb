package com.scroll.ocr.core.chat;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatDetectorTest {

    private static final String RULE = "=".repeat(60);

    private final ChatDetector detector = new ChatDetector();

    @Test
    void simpleSpeakerLinesLookLikeChat() {
        assertThat(detector.isLikelyChat("Alice: Hi\nBob: Hello\nAlice: How are you?")).isTrue();
    }

    @Test
    void proseIsNotChat() {
        String prose = "The quick brown fox jumps over the dog.\n"
            + "It was a sunny day in the park.\n"
            + "Nothing else happened afterwards.";

        assertThat(detector.isLikelyChat(prose)).isFalse();
    }

    @Test
    void fewerThanThreeLinesIsNeverChat() {
        assertThat(detector.isLikelyChat("Alice: Hi\n\n   \nBob: Hello")).isFalse();
    }

    @Test
    void parsesAllTimestampStyles() {
        String text = "[10:30] Alice: Hello there\n"
            + "10:31 Bob: Hi\n"
            + "Alice [10:32]: How are you?";

        List<ChatMessage> messages = detector.extractMessages(text);

        assertThat(messages).extracting(ChatMessage::getSpeaker).containsExactly("Alice", "Bob", "Alice");
        assertThat(messages).extracting(ChatMessage::getTimestamp).containsExactly("10:30", "10:31", "10:32");
        assertThat(messages).extracting(ChatMessage::getMessage)
            .containsExactly("Hello there", "Hi", "How are you?");
        assertThat(messages).extracting(ChatMessage::getLineNumber).containsExactly(0, 1, 2);
    }

    @Test
    void unmatchedLinesContinuePreviousMessage() {
        String text = "Alice: first line\nsecond line\n\nBob: ok";

        List<ChatMessage> messages = detector.extractMessages(text);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getMessage()).isEqualTo("first line\nsecond line");
        assertThat(messages.get(1).getLineNumber()).isEqualTo(3);
    }

    @Test
    void linesBeforeFirstMessageAreDropped() {
        List<ChatMessage> messages = detector.extractMessages("some header\nAlice: hi");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).getMessage()).isEqualTo("hi");
    }

    @Test
    void overlongSpeakerIsRejected() {
        String longName = "Abcdefghijklmnopqrstuvwxyzabcd";
        assertThat(longName).hasSize(30);

        assertThat(detector.extractMessages(longName + ": hello")).isEmpty();
        assertThat(detector.extractMessages("Abcdefghijklmnopqrstuvwxyzabc: hello")).hasSize(1);
    }

    @Test
    void speakerLikeLineIsNotAppendedAsContinuation() {
        List<ChatMessage> messages = detector.extractMessages("Alice: hi\nBob:\nCarol: hey");

        assertThat(messages).extracting(ChatMessage::getSpeaker).containsExactly("Alice", "Carol");
        assertThat(messages.get(0).getMessage()).isEqualTo("hi");
    }

    @Test
    void formatsConversationWithTimestamps() {
        List<ChatMessage> messages = Arrays.asList(
            new ChatMessage("Alice", "Hi", null, 0),
            new ChatMessage("Bob", "Yo\nthere", "9:00", 1));

        String expected = RULE + "\nCHAT CONVERSATION\n" + RULE + "\n\n"
            + "Alice:\n  Hi\n\n"
            + "[9:00] Bob:\n  Yo\n  there\n\n"
            + RULE + "\nTotal messages: 2\n" + RULE;

        assertThat(detector.formatConversation(messages)).isEqualTo(expected);
        assertThat(detector.formatConversation(messages, false)).contains("\nBob:\n").doesNotContain("[9:00]");
    }

    @Test
    void formattingNoMessagesGivesEmptyString() {
        assertThat(detector.formatConversation(List.of())).isEmpty();
    }

    @Test
    void summaryCountsParticipantsInOrderOfAppearance() {
        List<ChatMessage> messages = detector.extractMessages("Bob: a\nAlice: b\nBob: c");

        ConversationSummary summary = detector.summarize(messages);

        assertThat(summary.getTotalMessages()).isEqualTo(3);
        assertThat(summary.getParticipants()).containsExactly("Bob", "Alice");
        assertThat(summary.getMessageCountByParticipant()).containsEntry("Bob", 2).containsEntry("Alice", 1);
        assertThat(summary.isHasTimestamps()).isFalse();
    }

    @Test
    void processTextAddsHeaderForChat() {
        ChatProcessingResult result = detector.processText("Alice: Hi\nBob: Hello\nAlice: Bye");

        assertThat(result.isChatDetected()).isTrue();
        assertThat(result.getMessages()).hasSize(3);
        assertThat(result.getText())
            .startsWith("Detected chat conversation with 3 messages\nParticipants: Alice, Bob\n\n" + RULE);
    }

    @Test
    void processTextReturnsOriginalWhenNotChat() {
        String prose = "one line\nanother line\nthird line";

        ChatProcessingResult result = detector.processText(prose);

        assertThat(result.isChatDetected()).isFalse();
        assertThat(result.getText()).isEqualTo(prose);
        assertThat(result.getSummary()).isNull();
    }
}
