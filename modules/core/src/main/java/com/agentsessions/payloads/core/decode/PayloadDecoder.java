package com.agentsessions.payloads.core.decode;

import com.agentsessions.payloads.core.error.InvalidBase64Exception;
import com.agentsessions.payloads.core.error.PayloadIoException;
import com.agentsessions.payloads.core.error.PayloadTooLargeException;
import com.agentsessions.payloads.core.error.ScanCancelledException;
import com.agentsessions.payloads.core.locate.ScanRequest;
import com.agentsessions.payloads.scanner.api.LocatedSpan;
import com.agentsessions.payloads.scanner.api.Span;
import com.agentsessions.payloads.util.stream.ByteStreamReader;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.codec.binary.Base64;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * Decodes the base64 payload of a located span on demand.
 *
 * <p>Only the payload bytes are read, with one positioned read, and the decoded bytes
 * belong to the caller. The decoded-size budget is enforced twice: on the span's
 * estimate before reading, then on the exact decoded length.
 */
@ApplicationScoped
public class PayloadDecoder {

    private static final Logger log = Logger.getLogger(PayloadDecoder.class);

    @ConfigProperty(name = "payloads.decode.max-decoded-bytes", defaultValue = "26214400")
    long defaultMaxDecodedBytes;

    public byte[] decode(Path file, Span span) {
        return decode(file, span, defaultMaxDecodedBytes, ScanRequest.NEVER_CANCEL);
    }

    public byte[] decode(Path file, Span span, long maxDecodedBytes) {
        return decode(file, span, maxDecodedBytes, ScanRequest.NEVER_CANCEL);
    }

    /**
     * Decodes a located span, reading from its part file when it has one.
     */
    public byte[] decode(Path sessionFile, LocatedSpan located, long maxDecodedBytes, BooleanSupplier cancel) {
        return decode(located.sourceFile().orElse(sessionFile), located.span(), maxDecodedBytes, cancel);
    }

    /**
     * Reads and decodes one payload.
     *
     * @throws PayloadTooLargeException if the estimate or the exact size exceeds {@code maxDecodedBytes}
     * @throws InvalidBase64Exception   if the slice holds no decodable characters
     * @throws ScanCancelledException   if {@code cancel} fires before the read or before decoding
     * @throws PayloadIoException       if the file cannot be read
     */
    public byte[] decode(Path file, Span span, long maxDecodedBytes, BooleanSupplier cancel) {
        if (span.approxDecodedBytes() > maxDecodedBytes) {
            throw new PayloadTooLargeException(span.approxDecodedBytes(), maxDecodedBytes, false);
        }
        if (cancel.getAsBoolean()) {
            throw new ScanCancelledException("Decode cancelled before reading " + span.id());
        }

        byte[] encoded;
        try (ByteStreamReader reader = ByteStreamReader.open(file)) {
            encoded = reader.readSlice(span.payloadOffset(), span.payloadLength());
        } catch (IOException e) {
            throw new PayloadIoException(file, "Failed to read payload " + span.id(), e);
        }
        if (encoded.length < span.payloadLength()) {
            log.debugf("Payload %s of %s truncated: %d of %d bytes", span.id(), file, encoded.length, span.payloadLength());
        }

        if (cancel.getAsBoolean()) {
            throw new ScanCancelledException("Decode cancelled after reading " + span.id());
        }

        // Lenient: characters outside both base64 alphabets are skipped.
        byte[] decoded = Base64.decodeBase64(encoded);
        if (decoded.length == 0) {
            throw new InvalidBase64Exception("No base64 data in payload " + span.id() + " of " + file);
        }
        if (decoded.length > maxDecodedBytes) {
            throw new PayloadTooLargeException(decoded.length, maxDecodedBytes, true);
        }
        return decoded;
    }

    /**
     * Suggested file extension for a media type, {@code img} when unknown.
     */
    public static String fileExtensionFor(String mediaType) {
        if (mediaType == null) {
            return "img";
        }
        String type = mediaType.trim().toLowerCase(Locale.ROOT);
        int params = type.indexOf(';');
        if (params >= 0) {
            type = type.substring(0, params).trim();
        }
        if (!type.startsWith("image/")) {
            return "img";
        }
        String subtype = type.substring("image/".length());
        int suffix = subtype.indexOf('+');
        if (suffix >= 0) {
            subtype = subtype.substring(0, suffix);
        }
        return switch (subtype) {
            case "png" -> "png";
            case "jpeg", "jpg", "pjpeg" -> "jpg";
            case "gif" -> "gif";
            case "tiff", "tif" -> "tiff";
            case "heic" -> "heic";
            case "heif" -> "heif";
            default -> subtype.matches("[a-z0-9.-]{1,16}") ? subtype : "img";
        };
    }
}
