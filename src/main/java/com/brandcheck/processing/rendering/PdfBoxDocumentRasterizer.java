package com.brandcheck.processing.rendering;

import com.brandcheck.processing.model.PageImage;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders PDF pages to PNG files with PDFBox. Image inputs are passed through as a single page.
 */
@Service
public class PdfBoxDocumentRasterizer implements DocumentRasterizer {

    private static final Logger logger = LoggerFactory.getLogger(PdfBoxDocumentRasterizer.class);

    private final float dpi;
    private final DocumentValidator documentValidator;

    public PdfBoxDocumentRasterizer(
            @Value("${brandcheck.rasterizer.dpi:216}") float dpi,
            DocumentValidator documentValidator) {
        this.dpi = dpi;
        this.documentValidator = documentValidator;
        logger.info("PdfBoxDocumentRasterizer initialized: dpi={}", dpi);
    }

    @Override
    public List<PageImage> rasterize(Path document, Path outputDir) throws RasterizationException {
        if (documentValidator.isImage(document)) {
            if (!Files.isRegularFile(document)) {
                throw new RasterizationException("File not found: " + document);
            }
            logger.info("{} is already an image, analyzing as a single page", document.getFileName());
            return Collections.singletonList(new PageImage(1, document));
        }

        documentValidator.validatePdfSignature(document);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new RasterizationException("Failed to create raster directory " + outputDir, e);
        }

        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            int pageCount = pdf.getNumberOfPages();
            documentValidator.validatePageCount(document, pageCount);

            PDFRenderer renderer = new PDFRenderer(pdf);
            List<PageImage> pages = new ArrayList<>(pageCount);
            for (int index = 0; index < pageCount; index++) {
                int pageNumber = index + 1;
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                Path imagePath = outputDir.resolve("page-" + pageNumber + ".png");
                if (!ImageIO.write(image, "png", imagePath.toFile())) {
                    throw new RasterizationException("No PNG writer available for page " + pageNumber);
                }
                pages.add(new PageImage(pageNumber, imagePath, "image/png"));
            }

            logger.info("Converted {} pages of {}", pages.size(), document.getFileName());
            return pages;
        } catch (RasterizationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new RasterizationException("Failed to convert PDF: " + e.getMessage(), e);
        }
    }

    @Override
    public int countPages(Path document) throws RasterizationException {
        if (documentValidator.isImage(document)) {
            return 1;
        }
        documentValidator.validatePdfSignature(document);
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            return pdf.getNumberOfPages();
        } catch (IOException | RuntimeException e) {
            throw new RasterizationException("Failed to inspect PDF: " + e.getMessage(), e);
        }
    }
}
