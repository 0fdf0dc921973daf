package com.agentsessions.payloads.scanner.api;

import com.agentsessions.payloads.types.PositionKind;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link Span} plus the position tag its dialect assigns.
 *
 * <p>The tag is opaque context for the caller: a line index, an item index, or a
 * message id with the line inside that message's part file.
 *
 * @param span         the located payload
 * @param positionKind which kind of position {@code position} holds
 * @param position     0-based line or item index
 * @param messageId    originating message, only for {@link PositionKind#MESSAGE_PART}
 * @param sourceFile   file the span offsets refer to, only for {@link PositionKind#MESSAGE_PART}
 */
public record LocatedSpan(
        Span span,
        PositionKind positionKind,
        int position,
        Optional<String> messageId,
        Optional<Path> sourceFile
) {
    public LocatedSpan {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(positionKind, "positionKind");
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(sourceFile, "sourceFile");
        if (position < 0) {
            throw new IllegalArgumentException("Negative position: " + position);
        }
        if (positionKind == PositionKind.MESSAGE_PART && (messageId.isEmpty() || sourceFile.isEmpty())) {
            throw new IllegalArgumentException("Message-part spans need a message id and source file");
        }
    }

    public static LocatedSpan atLine(Span span, int lineIndex) {
        return new LocatedSpan(span, PositionKind.LINE, lineIndex, Optional.empty(), Optional.empty());
    }

    public static LocatedSpan atItem(Span span, int itemIndex) {
        return new LocatedSpan(span, PositionKind.ITEM, itemIndex, Optional.empty(), Optional.empty());
    }

    public static LocatedSpan inMessagePart(Span span, String messageId, Path partFile, int lineIndex) {
        return new LocatedSpan(span, PositionKind.MESSAGE_PART, lineIndex,
                Optional.of(messageId), Optional.of(partFile));
    }

    public String id() {
        return messageId.map(m -> m + "-" + span.id()).orElseGet(span::id);
    }
}
