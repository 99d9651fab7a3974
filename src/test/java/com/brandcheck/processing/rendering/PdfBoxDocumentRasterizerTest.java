package com.brandcheck.processing.rendering;

import com.brandcheck.TestPdfFactory;
import com.brandcheck.processing.model.PageImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PdfBoxDocumentRasterizer.
 * Uses real PDFs generated with PDFBox, rendered at low DPI to keep the test fast.
 */
class PdfBoxDocumentRasterizerTest {

    @TempDir
    Path tempDir;

    private PdfBoxDocumentRasterizer rasterizer;

    @BeforeEach
    void setUp() {
        rasterizer = new PdfBoxDocumentRasterizer(72f, new DocumentValidator(5));
    }

    @Test
    void testRendersEveryPageInOrder() throws IOException {
        // Given: a 3-page PDF
        Path pdf = TestPdfFactory.writePdf(tempDir.resolve("brochure.pdf"), "Brochure", 3);

        // When
        List<PageImage> pages = rasterizer.rasterize(pdf, tempDir.resolve("out"));

        // Then: one PNG per page, numbered from 1
        assertThat(pages).extracting(PageImage::getPageNumber).containsExactly(1, 2, 3);
        assertThat(pages).allSatisfy(page -> {
            assertThat(Files.size(page.getPath())).isPositive();
            assertThat(page.getMimeType()).isEqualTo("image/png");
        });
        assertThat(rasterizer.countPages(pdf)).isEqualTo(3);
    }

    @Test
    void testDifferentPagesProduceDifferentImages() throws IOException {
        Path pdf = TestPdfFactory.writePdf(tempDir.resolve("two.pdf"), "Two", 2);

        List<PageImage> pages = rasterizer.rasterize(pdf, tempDir.resolve("out"));

        assertThat(Files.readAllBytes(pages.get(0).getPath()))
                .isNotEqualTo(Files.readAllBytes(pages.get(1).getPath()));
    }

    @Test
    void testImageInputPassesThroughAsSinglePage() throws IOException {
        Path image = tempDir.resolve("poster.jpg");
        Files.write(image, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00});

        List<PageImage> pages = rasterizer.rasterize(image, tempDir.resolve("out"));

        assertThat(pages).hasSize(1);
        assertThat(pages.get(0).getPath()).isEqualTo(image);
        assertThat(pages.get(0).getMimeType()).isEqualTo("image/jpeg");
        assertThat(rasterizer.countPages(image)).isEqualTo(1);
    }

    @Test
    void testNonPdfIsRejected() throws IOException {
        Path fake = tempDir.resolve("fake.pdf");
        Files.writeString(fake, "NOT A PDF FILE");

        assertThatThrownBy(() -> rasterizer.rasterize(fake, tempDir.resolve("out")))
                .isInstanceOf(RasterizationException.class)
                .hasMessageContaining("Not a PDF");
        assertThatThrownBy(() -> rasterizer.countPages(fake))
                .isInstanceOf(RasterizationException.class);
    }

    @Test
    void testMissingFileIsRejected() {
        assertThatThrownBy(() -> rasterizer.rasterize(tempDir.resolve("missing.pdf"), tempDir.resolve("out")))
                .isInstanceOf(RasterizationException.class)
                .hasMessageContaining("File not found");
    }

    @Test
    void testTooManyPagesIsRejected() throws IOException {
        Path pdf = TestPdfFactory.writePdf(tempDir.resolve("long.pdf"), "Long", 6);

        assertThatThrownBy(() -> rasterizer.rasterize(pdf, tempDir.resolve("out")))
                .isInstanceOf(RasterizationException.class)
                .hasMessageContaining("exceeds maximum");
    }

    @Test
    void testPathWithoutFileNameIsRejected() {
        Path root = Paths.get("/");

        assertThatThrownBy(() -> rasterizer.countPages(root)).isInstanceOf(RasterizationException.class);
        assertThatThrownBy(() -> rasterizer.rasterize(root, tempDir.resolve("out")))
                .isInstanceOf(RasterizationException.class);
        assertThat(new PageImage(1, root).getMimeType()).isEqualTo("image/png");
    }
}
