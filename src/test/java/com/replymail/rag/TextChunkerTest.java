package com.replymail.rag;

import com.replymail.config.AssistantProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TextChunker unit tests
 */
class TextChunkerTest {

    private static TextChunker chunker(int size, int overlap) {
        AssistantProperties properties = new AssistantProperties();
        properties.getRetrieval().setChunkSize(size);
        properties.getRetrieval().setChunkOverlap(overlap);
        return new TextChunker(properties);
    }

    @Test
    @DisplayName("Short text stays in one chunk")
    void testSingleChunk() {
        assertThat(chunker(1000, 200).split("A short note.")).containsExactly("A short note.");
    }

    @Test
    @DisplayName("Long text split into bounded chunks")
    void testBoundedChunks() {
        String text = "First paragraph talks about shipping times.\n\n"
                + "Second paragraph covers the refund policy.\n\n"
                + "Third paragraph lists the office opening hours.";

        List<String> chunks = chunker(50, 0).split(text);

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(3);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(50));
        assertThat(String.join(" ", chunks)).contains("shipping").contains("refund").contains("opening hours");
    }

    @Test
    @DisplayName("Blank text yields no chunks")
    void testBlank() {
        assertThat(chunker(100, 10).split("  \n ")).isEmpty();
        assertThat(chunker(100, 10).split(null)).isEmpty();
    }
}
