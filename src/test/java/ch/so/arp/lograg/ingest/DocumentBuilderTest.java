package ch.so.arp.lograg.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

class DocumentBuilderTest {

    private static final String SOURCE = "/logs/2024-05-01.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void groupsRecordsIntoDocuments() {
        List<ObjectNode> records = records(3);

        List<Document> grouped = builder(20, 2000, 100).documents(SOURCE, records);
        List<Document> single = builder(1, 2000, 100).documents(SOURCE, records);

        assertThat(grouped).hasSize(1);
        assertThat(grouped.get(0).index()).isZero();
        assertThat(single).extracting(Document::index).containsExactly(0, 1, 2);
        assertThat(single).extracting(Document::source).containsOnly(SOURCE);
    }

    @Test
    void rendersRecordsPrettyPrintedInFieldOrder() {
        List<Document> documents = builder(20, 2000, 100).documents(SOURCE, records(2));

        String text = documents.get(0).text();
        assertThat(text).startsWith("{\n  \"timestamp\" : \"2024-05-01T10:00:00Z\",\n  \"level\" : \"ERROR\"");
        assertThat(text).contains("}\n{\n  \"timestamp\" : \"2024-05-01T10:01:00Z\"");
        assertThat(text.indexOf("\"level\"")).isLessThan(text.indexOf("\"message\""));
    }

    @Test
    void chunksLongDocumentsAndKeepsProvenance() {
        DocumentBuilder builder = builder(20, 120, 30);

        List<Chunk> chunks = builder.build(SOURCE, records(10));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.source()).isEqualTo(SOURCE);
            assertThat(chunk.documentIndex()).isZero();
            assertThat(chunk.text().length()).isLessThanOrEqualTo(120);
            assertThat(chunk.overlap()).isBetween(0, 30);
        });
        assertThat(chunks).extracting(Chunk::chunkIndex)
                .containsExactlyElementsOf(range(chunks.size()));

        Document document = builder.documents(SOURCE, records(10)).get(0);
        StringBuilder rebuilt = new StringBuilder(chunks.get(0).text());
        for (Chunk chunk : chunks.subList(1, chunks.size())) {
            rebuilt.append(chunk.text().substring(chunk.overlap()));
        }
        assertThat(rebuilt.toString()).isEqualTo(document.text());
    }

    @Test
    void chunkIdsAreStableAndDistinct() {
        List<Chunk> first = builder(1, 2000, 100).build(SOURCE, records(3));
        List<Chunk> second = builder(1, 2000, 100).build(SOURCE, records(3));
        List<Chunk> otherFile = builder(1, 2000, 100).build("/logs/2024-05-02.json", records(3));

        assertThat(first).extracting(Chunk::pointId).containsExactlyElementsOf(
                second.stream().map(Chunk::pointId).toList());
        assertThat(first).extracting(Chunk::pointId).doesNotHaveDuplicates()
                .doesNotContainAnyElementsOf(otherFile.stream().map(Chunk::pointId).toList());
        assertThat(first.get(1).metadata())
                .containsEntry("source", SOURCE)
                .containsEntry("document_index", 1)
                .containsEntry("chunk_index", 0);
    }

    @Test
    void noRecordsNoChunks() {
        assertThat(builder(20, 2000, 100).build(SOURCE, List.of())).isEmpty();
    }

    private DocumentBuilder builder(int groupSize, int chunkSize, int chunkOverlap) {
        return new DocumentBuilder(groupSize, new RecursiveCharacterSplitter(chunkSize, chunkOverlap), objectMapper);
    }

    private List<ObjectNode> records(int count) {
        List<ObjectNode> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ObjectNode record = objectMapper.createObjectNode();
            record.put("timestamp", String.format("2024-05-01T10:%02d:00Z", i));
            record.put("level", i % 2 == 0 ? "ERROR" : "INFO");
            record.put("message", "Container api-" + i + " restarted after OOMKilled");
            records.add(record);
        }
        return records;
    }

    private static List<Integer> range(int size) {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            values.add(i);
        }
        return values;
    }
}
