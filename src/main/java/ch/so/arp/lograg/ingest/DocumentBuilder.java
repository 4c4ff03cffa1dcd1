package ch.so.arp.lograg.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns the records of one log file into chunks. Records are grouped into
 * documents of at most {@code groupSize} records, each record pretty printed
 * with its field order intact, and every document is cut by the
 * {@link RecursiveCharacterSplitter}.
 */
class DocumentBuilder {

    private final int groupSize;
    private final RecursiveCharacterSplitter splitter;
    private final ObjectWriter recordWriter;

    DocumentBuilder(int groupSize, RecursiveCharacterSplitter splitter, ObjectMapper objectMapper) {
        if (groupSize <= 0) {
            throw new IllegalArgumentException("groupSize must be positive");
        }
        this.groupSize = groupSize;
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        this.recordWriter = objectMapper.writer(printer);
    }

    List<Chunk> build(String source, List<ObjectNode> records) {
        return chunk(documents(source, records));
    }

    List<Document> documents(String source, List<ObjectNode> records) {
        List<Document> documents = new ArrayList<>();
        for (int from = 0; from < records.size(); from += groupSize) {
            List<ObjectNode> group = records.subList(from, Math.min(from + groupSize, records.size()));
            List<String> rendered = new ArrayList<>(group.size());
            for (ObjectNode record : group) {
                rendered.add(render(source, record));
            }
            documents.add(new Document(source, documents.size(), String.join("\n", rendered)));
        }
        return documents;
    }

    List<Chunk> chunk(List<Document> documents) {
        List<Chunk> chunks = new ArrayList<>();
        for (Document document : documents) {
            int previousEnd = 0;
            int chunkIndex = 0;
            for (RecursiveCharacterSplitter.Span span : splitter.split(document.text())) {
                int overlap = chunkIndex == 0 ? 0 : Math.max(0, previousEnd - span.start());
                chunks.add(new Chunk(document.source(), document.index(), chunkIndex, span.start(), overlap,
                        document.text().substring(span.start(), span.end())));
                previousEnd = span.end();
                chunkIndex++;
            }
        }
        return chunks;
    }

    private String render(String source, ObjectNode record) {
        try {
            return recordWriter.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            throw new SourceFileParseException(source, "Unable to render a record of " + source, ex);
        }
    }
}
