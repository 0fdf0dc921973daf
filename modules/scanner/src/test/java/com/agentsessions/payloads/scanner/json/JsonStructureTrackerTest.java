package com.agentsessions.payloads.scanner.json;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonStructureTrackerTest {

    /** Buffers "name", counts "big", ignores everything else. */
    private static final class RecordingPolicy implements JsonScanPolicy<Void> {
        final List<String> small = new ArrayList<>();
        final List<String> parentKeys = new ArrayList<>();
        final List<LargeString> large = new ArrayList<>();
        final List<Long> closedObjects = new ArrayList<>();
        final List<Long> endedLines = new ArrayList<>();
        boolean endOfInput;

        @Override
        public Void open(JsonFrame<Void> frame) {
            return null;
        }

        @Override
        public StringClass classifyValue(JsonFrame<Void> object, String key) {
            return switch (key) {
                case "name" -> StringClass.SMALL_VALUE;
                case "big" -> StringClass.LARGE_VALUE;
                default -> StringClass.IGNORED;
            };
        }

        @Override
        public void onSmallValue(JsonFrame<Void> object, String key, String value) {
            small.add(value);
            parentKeys.add(object.parentKey());
        }

        @Override
        public void onLargeValue(JsonFrame<Void> object, String key, LargeString value) {
            large.add(value);
        }

        @Override
        public void onObjectClose(JsonFrame<Void> object) {
            closedObjects.add(object.openOffset());
        }

        @Override
        public void onLineEnd(long lineIndex) {
            endedLines.add(lineIndex);
        }

        @Override
        public void onEndOfInput(long lineIndex) {
            endOfInput = true;
        }
    }

    private static RecordingPolicy track(String json, boolean lineDelimited) {
        RecordingPolicy policy = new RecordingPolicy();
        JsonStructureTracker<Void> tracker = new JsonStructureTracker<>(policy, lineDelimited);
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        tracker.feed(bytes, 0, bytes.length, 0);
        tracker.finish();
        return policy;
    }

    @Test
    void shouldReportSmallValuesForClassifiedKeys() {
        RecordingPolicy policy = track("{\"id\":\"x\",\"name\":\"alpha\"}", false);
        assertThat(policy.small).containsExactly("alpha");
        assertThat(policy.endOfInput).isTrue();
    }

    @Test
    void shouldUnescapeQuotesBackslashesAndSlashes() {
        // {"name":"a\"b\/c\n"}
        RecordingPolicy policy = track("{\"name\":\"a\\\"b\\/c\\n\"}", false);
        assertThat(policy.small).containsExactly("a\"b/c\\n");
    }

    @Test
    void shouldTruncateLongSmallValues() {
        String value = "v".repeat(JsonStructureTracker.MAX_SMALL_STRING_BYTES + 100);
        RecordingPolicy policy = track("{\"name\":\"" + value + "\"}", false);
        assertThat(policy.small.get(0)).hasSize(JsonStructureTracker.MAX_SMALL_STRING_BYTES);
    }

    @Test
    void shouldRecordLargeValueOffsets() {
        String json = "{\"big\":\"QUJDRA==\"}";
        RecordingPolicy policy = track(json, false);
        assertThat(policy.large).hasSize(1);
        LargeString big = policy.large.get(0);
        assertThat(big.contentOffset()).isEqualTo(json.indexOf("QUJD"));
        assertThat(big.endQuoteOffset()).isEqualTo(json.lastIndexOf('"'));
        assertThat(big.length()).isEqualTo(8);
        assertThat(big.usable()).isTrue();
    }

    @Test
    void shouldInvalidateEscapedLargeValueWithoutShiftingOffsets() {
        String json = "{\"big\":\"ab\\\\cd\",\"name\":\"after\"}";
        RecordingPolicy policy = track(json, false);
        LargeString big = policy.large.get(0);
        assertThat(big.valid()).isFalse();
        assertThat(big.usable()).isFalse();
        assertThat(big.length()).isEqualTo(6);
        assertThat(policy.small).containsExactly("after");
    }

    @Test
    void shouldIgnoreKeysAndValuesInsideIgnoredStrings() {
        // JSON-looking text inside an ignored value must not produce callbacks
        RecordingPolicy policy = track("{\"text\":\"{\\\"name\\\":\\\"inner\\\"}\",\"name\":\"outer\"}", false);
        assertThat(policy.small).containsExactly("outer");
    }

    @Test
    void shouldAdvancePastScalarsAndNestedContainers() {
        RecordingPolicy policy = track(
                "{\"n\":12,\"b\":true,\"z\":null,\"o\":{\"x\":[1,2]},\"arr\":[\"s\",{\"name\":\"in\"}],\"name\":\"out\"}",
                false);
        assertThat(policy.small).containsExactly("in", "out");
    }

    @Test
    void shouldExposeParentKey() {
        RecordingPolicy policy = track("{\"outer\":{\"name\":\"v\"},\"list\":[{\"name\":\"w\"}]}", false);
        assertThat(policy.parentKeys).containsExactly("outer", null);
    }

    @Test
    void shouldTolerateUnmatchedClosers() {
        RecordingPolicy policy = track("]}]{\"name\":\"ok\"}}}", false);
        assertThat(policy.small).containsExactly("ok");
    }

    @Test
    void shouldReportObjectCloseWithOpenOffset() {
        String json = "[{\"a\":1},{\"b\":2}]";
        RecordingPolicy policy = track(json, false);
        assertThat(policy.closedObjects).containsExactly(1L, (long) json.indexOf("{\"b\""));
    }

    @Test
    void shouldResetOnEveryNewlineInLineMode() {
        String torn = "{\"name\":\"unterminated\n{\"name\":\"ok\"}\n";
        RecordingPolicy policy = track(torn, true);
        assertThat(policy.small).containsExactly("ok");
        assertThat(policy.endedLines).containsExactly(0L, 1L);
    }

    @Test
    void shouldKeepStateAcrossNewlinesInDocumentMode() {
        RecordingPolicy policy = track("{\n  \"id\": 1,\n  \"name\": \"doc\"\n}\n", false);
        assertThat(policy.small).containsExactly("doc");
        assertThat(policy.endedLines).isEmpty();
    }

    @Test
    void shouldProduceSameResultForAnyChunking() {
        String json = "{\"big\":\"QUJDRA==\",\"name\":\"x\"}\n{\"name\":\"y\",\"big\":\"RUZH\"}";
        RecordingPolicy whole = track(json, true);

        RecordingPolicy policy = new RecordingPolicy();
        JsonStructureTracker<Void> tracker = new JsonStructureTracker<>(policy, true);
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            tracker.feed(bytes, i, 1, i);
        }
        tracker.finish();

        assertThat(policy.small).isEqualTo(whole.small);
        assertThat(policy.large).isEqualTo(whole.large);
        assertThat(tracker.lineIndex()).isEqualTo(1);
    }

    @Test
    void shouldStopFeedingOnceHalted() {
        List<String> seen = new ArrayList<>();
        JsonScanPolicy<Void> stopAfterFirst = new JsonScanPolicy<>() {
            @Override
            public Void open(JsonFrame<Void> frame) {
                return null;
            }

            @Override
            public StringClass classifyValue(JsonFrame<Void> object, String key) {
                return StringClass.SMALL_VALUE;
            }

            @Override
            public void onSmallValue(JsonFrame<Void> object, String key, String value) {
                seen.add(value);
            }

            @Override
            public void onLargeValue(JsonFrame<Void> object, String key, LargeString value) {
            }

            @Override
            public boolean halted() {
                return !seen.isEmpty();
            }
        };
        JsonStructureTracker<Void> tracker = new JsonStructureTracker<>(stopAfterFirst, false);
        byte[] bytes = "{\"a\":\"1\",\"b\":\"2\"}".getBytes(StandardCharsets.UTF_8);
        tracker.feed(bytes, 0, bytes.length, 0);
        assertThat(seen).containsExactly("1");
        assertThat(tracker.isHalted()).isTrue();
    }
}
