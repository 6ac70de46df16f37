package com.replymail.rag;

import com.replymail.config.AssistantProperties;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounded-size overlapping chunks (paragraph -> sentence -> word recursive split)
 */
@Component
public class TextChunker {

    private final DocumentSplitter splitter;

    public TextChunker(AssistantProperties properties) {
        AssistantProperties.Retrieval retrieval = properties.getRetrieval();
        this.splitter = DocumentSplitters.recursive(retrieval.getChunkSize(), retrieval.getChunkOverlap());
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return splitter.split(Document.from(text)).stream()
                .map(TextSegment::text)
                .filter(s -> !s.isBlank())
                .toList();
    }
}
