package ai.claudian.storage.sessions;

import org.jetbrains.annotations.Nullable;

/** Lightweight listing entry for the conversation history dropdown. */
public record ConversationMeta(
        String id,
        String title,
        long createdAt,
        long updatedAt,
        @Nullable Long lastResponseAt,
        int messageCount,
        String preview) {

    static final int PREVIEW_LENGTH = 50;
    static final String EMPTY_PREVIEW = "New conversation";

    static ConversationMeta of(ConversationTranscript transcript) {
        String preview = transcript.messages().stream()
                .filter(m -> m.role() == ChatMessage.Role.USER)
                .map(m -> m.content().strip())
                .filter(c -> !c.isEmpty())
                .findFirst()
                .map(ConversationMeta::truncate)
                .orElse(EMPTY_PREVIEW);
        return new ConversationMeta(
                transcript.id(),
                transcript.title(),
                transcript.createdAt(),
                transcript.updatedAt(),
                transcript.lastResponseAt(),
                transcript.messages().size(),
                preview);
    }

    private static String truncate(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
