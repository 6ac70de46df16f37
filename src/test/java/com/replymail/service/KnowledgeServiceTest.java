package com.replymail.service;

import com.replymail.domain.IngestionResult;
import com.replymail.domain.KnowledgeDocument;
import com.replymail.rag.PdfTextExtractor;
import com.replymail.rag.RetrievalIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * KnowledgeService unit tests
 */
@ExtendWith(MockitoExtension.class)
class KnowledgeServiceTest {

    @Mock
    private RetrievalIndex retrievalIndex;

    @Mock
    private PdfTextExtractor pdfTextExtractor;

    @InjectMocks
    private KnowledgeService knowledgeService;

    @Test
    @DisplayName("User document: default title, generated document id")
    void testIngestDocument() {
        when(retrievalIndex.ingest(any())).thenReturn(List.of("c1", "c2"));

        IngestionResult result = knowledgeService.ingestDocument(null, "Body text", List.of("faq"));

        ArgumentCaptor<KnowledgeDocument> captor = ArgumentCaptor.forClass(KnowledgeDocument.class);
        verify(retrievalIndex).ingest(captor.capture());
        KnowledgeDocument doc = captor.getValue();
        assertThat(doc.title()).isEqualTo("User Document");
        assertThat(doc.source()).isEqualTo(KnowledgeService.SOURCE_DOCUMENT);
        assertThat(doc.topics()).containsExactly("faq");
        assertThat(doc.documentId()).isNotBlank();
        assertThat(result.documentId()).isEqualTo(doc.documentId());
        assertThat(result.chunkIds()).containsExactly("c1", "c2");
    }

    @Test
    @DisplayName("Article content is prefixed with its title")
    void testIngestArticle() {
        when(retrievalIndex.ingest(any())).thenReturn(List.of("c1"));

        knowledgeService.ingestArticle("Rates rise", "The central bank raised rates.",
                "https://news.example.com/rates", List.of());

        ArgumentCaptor<KnowledgeDocument> captor = ArgumentCaptor.forClass(KnowledgeDocument.class);
        verify(retrievalIndex).ingest(captor.capture());
        assertThat(captor.getValue().content()).isEqualTo("Title: Rates rise\n\nThe central bank raised rates.");
        assertThat(captor.getValue().source()).isEqualTo(KnowledgeService.SOURCE_ARTICLE);
        assertThat(captor.getValue().url()).isEqualTo("https://news.example.com/rates");
    }

    @Test
    @DisplayName("PDF text is extracted before ingestion")
    void testIngestPdf() {
        byte[] bytes = {1, 2, 3};
        when(pdfTextExtractor.extract(bytes, "manual.pdf")).thenReturn("Manual text");
        when(retrievalIndex.ingest(any())).thenReturn(List.of("c1"));

        knowledgeService.ingestPdf("manual.pdf", bytes, List.of("docs"));

        ArgumentCaptor<KnowledgeDocument> captor = ArgumentCaptor.forClass(KnowledgeDocument.class);
        verify(retrievalIndex).ingest(captor.capture());
        assertThat(captor.getValue().content()).isEqualTo("Manual text");
        assertThat(captor.getValue().title()).isEqualTo("manual.pdf");
        assertThat(captor.getValue().source()).isEqualTo(KnowledgeService.SOURCE_PDF);
    }

    @Test
    @DisplayName("Search falls back to the default k")
    void testSearchDefaultK() {
        when(retrievalIndex.search("query", 5)).thenReturn(List.of());

        knowledgeService.search("query", null, 5);
        knowledgeService.search("query", 0, 5);

        verify(retrievalIndex, times(2)).search(eq("query"), eq(5));
    }
}
