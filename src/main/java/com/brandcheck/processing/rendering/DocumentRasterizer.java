package com.brandcheck.processing.rendering;

import com.brandcheck.processing.model.PageImage;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a document into one image per page.
 */
public interface DocumentRasterizer {

    /**
     * Renders every page of {@code document} into {@code outputDir}.
     *
     * @return pages in increasing page-number order
     * @throws RasterizationException if the document cannot be read or rendered
     */
    List<PageImage> rasterize(Path document, Path outputDir) throws RasterizationException;

    /**
     * Cheap page count used to size progress reporting before any rendering happens.
     *
     * @throws RasterizationException if the document cannot be inspected
     */
    int countPages(Path document) throws RasterizationException;
}
