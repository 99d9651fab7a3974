package com.brandcheck.processing.rendering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Validates input documents before rendering: file type by extension and magic bytes, and page count limit.
 */
@Component
public class DocumentValidator {

    private static final Logger logger = LoggerFactory.getLogger(DocumentValidator.class);
    private static final byte[] PDF_MAGIC_BYTES = "%PDF".getBytes();
    private static final int MAGIC_BYTES_LENGTH = 4;

    private final int maxPages;

    public DocumentValidator(@Value("${brandcheck.rasterizer.max-pages:200}") int maxPages) {
        this.maxPages = maxPages;
        logger.info("DocumentValidator initialized: maxPages={}", maxPages);
    }

    /**
     * True for PNG/JPEG inputs, which are analyzed as a single page without rendering.
     */
    public boolean isImage(Path document) {
        Path fileName = document.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg");
    }

    /**
     * Checks that the file starts with the PDF signature ({@code %PDF}).
     *
     * @throws RasterizationException if the file is missing, too short or not a PDF
     */
    public void validatePdfSignature(Path document) throws RasterizationException {
        if (!Files.isRegularFile(document)) {
            throw new RasterizationException("File not found: " + document);
        }

        byte[] header = new byte[MAGIC_BYTES_LENGTH];
        int bytesRead;
        try (InputStream in = Files.newInputStream(document)) {
            bytesRead = in.readNBytes(header, 0, MAGIC_BYTES_LENGTH);
        } catch (IOException e) {
            throw new RasterizationException("Failed to read document header: " + e.getMessage(), e);
        }

        if (bytesRead < MAGIC_BYTES_LENGTH) {
            logger.warn("Document validation failed: file too short (read {} bytes, expected at least {})",
                    bytesRead, MAGIC_BYTES_LENGTH);
            throw new RasterizationException("File is too short to be a PDF: " + document.getFileName());
        }

        for (int i = 0; i < MAGIC_BYTES_LENGTH; i++) {
            if (header[i] != PDF_MAGIC_BYTES[i]) {
                logger.warn("Document validation failed: magic bytes mismatch at position {} (expected {}, got {})",
                        i, PDF_MAGIC_BYTES[i], header[i]);
                throw new RasterizationException("Not a PDF document: " + document.getFileName());
            }
        }
    }

    /**
     * @throws RasterizationException if the page count is zero or above the configured limit
     */
    public void validatePageCount(Path document, int pageCount) throws RasterizationException {
        if (pageCount < 1) {
            throw new RasterizationException("Document has no pages: " + document.getFileName());
        }
        if (pageCount > maxPages) {
            logger.warn("Document validation failed: page count ({}) exceeds maximum ({}) for {}",
                    pageCount, maxPages, document.getFileName());
            throw new RasterizationException(String.format(
                    "Document page count (%d) exceeds maximum allowed (%d pages)", pageCount, maxPages));
        }
    }

    public int getMaxPages() {
        return maxPages;
    }
}
