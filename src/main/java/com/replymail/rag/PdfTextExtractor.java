package com.replymail.rag;

import com.replymail.exception.AssistantException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * PDF -> plain text ahead of ingestion
 */
@Slf4j
@Component
public class PdfTextExtractor {

    public String extract(byte[] content, String fileName) {
        if (content == null || content.length == 0) {
            throw new AssistantException("PDF_EMPTY", "Uploaded PDF is empty: " + fileName);
        }
        try (PDDocument doc = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(doc);
            log.info("Extracted {} chars from {} ({} pages)", text.length(), fileName, doc.getNumberOfPages());
            return text;
        } catch (IOException e) {
            throw new AssistantException("PDF_EXTRACTION_FAILED", "Cannot read PDF " + fileName, e);
        }
    }
}
