package com.agentsessions.payloads.core.locate;

import com.agentsessions.payloads.util.stream.ByteStreamReader;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Checks whether a data URL sits in a JSON {@code image_url} field, as in
 * {@code "image_url":"data:image..."} or {@code "image_url":{"url":"data:image..."}}.
 *
 * <p>Only the line around the span start is inspected, through a small positioned read.
 * Quotes must be unescaped so JSON quoted inside tool output does not qualify.
 */
@ApplicationScoped
public class ImageUrlContextProbe {

    static final int LOOK_BACK = 160;
    static final int LOOK_AHEAD = 64;

    private static final Pattern IMAGE_URL_CONTEXT = Pattern.compile(
            "(?<!\\\\)\"image_url\"\\s*:\\s*(?:\\{\\s*(?<!\\\\)\"url\"\\s*:\\s*)?(?<!\\\\)\"data:image",
            Pattern.CASE_INSENSITIVE);

    /**
     * @param reader      open reader over the file the span lives in
     * @param startOffset offset of the span's {@code data:image} marker
     */
    public boolean isImageUrlContext(ByteStreamReader reader, long startOffset) throws IOException {
        int lookBack = (int) Math.min(LOOK_BACK, startOffset);
        byte[] window = reader.readSlice(startOffset - lookBack, lookBack + LOOK_AHEAD);

        int center = Math.min(lookBack, window.length);
        int lineStart = 0;
        for (int i = center - 1; i >= 0; i--) {
            if (window[i] == '\n') {
                lineStart = i + 1;
                break;
            }
        }
        int lineEnd = window.length;
        for (int i = center; i < window.length; i++) {
            if (window[i] == '\n') {
                lineEnd = i;
                break;
            }
        }
        if (lineStart >= lineEnd) {
            return false;
        }
        String line = new String(window, lineStart, lineEnd - lineStart, StandardCharsets.UTF_8);
        return IMAGE_URL_CONTEXT.matcher(line).find();
    }
}
