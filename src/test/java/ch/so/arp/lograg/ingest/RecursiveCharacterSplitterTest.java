package ch.so.arp.lograg.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.lograg.ingest.RecursiveCharacterSplitter.Span;

class RecursiveCharacterSplitterTest {

    @Test
    void shortTextIsOneChunk() {
        RecursiveCharacterSplitter splitter = new RecursiveCharacterSplitter(100, 10);

        assertThat(splitter.split("OOMKilled")).containsExactly(new Span(0, 9));
    }

    @Test
    void emptyTextHasNoChunks() {
        assertThat(new RecursiveCharacterSplitter(10, 2).split("")).isEmpty();
    }

    @Test
    void cutsUnbrokenTextWithOverlap() {
        RecursiveCharacterSplitter splitter = new RecursiveCharacterSplitter(10, 3);

        List<Span> spans = splitter.split("x".repeat(25));

        assertThat(spans).containsExactly(new Span(0, 10), new Span(7, 17), new Span(14, 24), new Span(21, 25));
    }

    @Test
    void prefersParagraphBreaks() {
        RecursiveCharacterSplitter splitter = new RecursiveCharacterSplitter(10, 0);
        String text = "aaaa\n\nbbbb\n\ncccc";

        List<String> chunks = splitter.split(text).stream()
                .map(span -> text.substring(span.start(), span.end()))
                .toList();

        assertThat(chunks).containsExactly("aaaa\n\n", "bbbb\n\ncccc");
    }

    @Test
    void neverSplitsSurrogatePairs() {
        RecursiveCharacterSplitter splitter = new RecursiveCharacterSplitter(3, 0);
        String text = "😀😀😀";

        List<String> chunks = splitter.split(text).stream()
                .map(span -> text.substring(span.start(), span.end()))
                .toList();

        assertThat(chunks).containsExactly("😀", "😀", "😀");
    }

    @Test
    void smallestChunkSizeStillKeepsSurrogatePairsWhole() {
        RecursiveCharacterSplitter splitter = new RecursiveCharacterSplitter(2, 0);
        String text = "a😀b";

        List<String> chunks = splitter.split(text).stream()
                .map(span -> text.substring(span.start(), span.end()))
                .toList();

        assertThat(chunks).containsExactly("a", "😀", "b");
    }

    @Test
    void chunksRespectSizeAndOverlapAndCoverTheText() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            builder.append("{\n  \"timestamp\" : \"2024-05-01T10:").append(String.format("%02d", i))
                    .append(":00Z\",\n  \"message\" : \"pod restarted after liveness probe failure ").append(i)
                    .append("\"\n}");
            builder.append(i % 5 == 4 ? "\n\n" : "\n");
        }
        String text = builder.toString();

        for (int[] settings : new int[][] { { 50, 0 }, { 80, 20 }, { 200, 50 }, { 500, 100 }, { 7, 6 } }) {
            int size = settings[0];
            int overlap = settings[1];
            List<Span> spans = new RecursiveCharacterSplitter(size, overlap).split(text);

            StringBuilder rebuilt = new StringBuilder();
            int previousEnd = 0;
            for (int i = 0; i < spans.size(); i++) {
                Span span = spans.get(i);
                assertThat(span.length()).isPositive().isLessThanOrEqualTo(size);
                int shared = i == 0 ? 0 : previousEnd - span.start();
                assertThat(shared).isBetween(0, overlap);
                rebuilt.append(text, span.start() + shared, span.end());
                previousEnd = span.end();
            }
            assertThat(rebuilt.toString()).as("size %d overlap %d", size, overlap).isEqualTo(text);
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RecursiveCharacterSplitter(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecursiveCharacterSplitter(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecursiveCharacterSplitter(10, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RecursiveCharacterSplitter(10, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
