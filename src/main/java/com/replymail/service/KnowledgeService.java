package com.replymail.service;

import com.replymail.domain.IngestionResult;
import com.replymail.domain.KnowledgeDocument;
import com.replymail.domain.ScoredChunk;
import com.replymail.rag.PdfTextExtractor;
import com.replymail.rag.RetrievalIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Knowledge ingestion service
 * - User documents, news articles and PDFs into the retrieval index
 * - Search and stats for the ingestion surface
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeService {

    public static final String SOURCE_DOCUMENT = "user_document";
    public static final String SOURCE_ARTICLE = "news_article";
    public static final String SOURCE_PDF = "pdf_document";

    private final RetrievalIndex retrievalIndex;
    private final PdfTextExtractor pdfTextExtractor;

    public IngestionResult ingestDocument(String title, String content, List<String> topics) {
        return ingest(KnowledgeDocument.builder()
                .title(title == null || title.isBlank() ? "User Document" : title)
                .content(content)
                .source(SOURCE_DOCUMENT)
                .topics(topics));
    }

    /**
     * Article body is prefixed with its title so the title is searchable in every chunk's document
     */
    public IngestionResult ingestArticle(String title, String content, String url, List<String> topics) {
        String safeTitle = title == null ? "" : title.strip();
        return ingest(KnowledgeDocument.builder()
                .title(safeTitle)
                .content("Title: " + safeTitle + "\n\n" + (content == null ? "" : content))
                .source(SOURCE_ARTICLE)
                .url(url)
                .topics(topics));
    }

    public IngestionResult ingestPdf(String fileName, byte[] content, List<String> topics) {
        String text = pdfTextExtractor.extract(content, fileName);
        return ingest(KnowledgeDocument.builder()
                .title(fileName)
                .content(text)
                .source(SOURCE_PDF)
                .topics(topics));
    }

    private IngestionResult ingest(KnowledgeDocument.KnowledgeDocumentBuilder builder) {
        String documentId = UUID.randomUUID().toString();
        List<String> chunkIds = retrievalIndex.ingest(builder.documentId(documentId).build());
        return new IngestionResult(documentId, chunkIds);
    }

    public int removeDocument(String documentId) {
        return retrievalIndex.removeDocument(documentId);
    }

    public List<ScoredChunk> search(String query, Integer k, int defaultK) {
        int limit = k == null || k <= 0 ? defaultK : k;
        return retrievalIndex.search(query, limit);
    }

    public Map<String, Object> stats() {
        return retrievalIndex.stats();
    }
}
