package com.brandcheck.processing.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Handle to one rasterized page on disk.
 */
public class PageImage {

    private final int pageNumber;
    private final Path path;
    private final String mimeType;

    public PageImage(int pageNumber, Path path, String mimeType) {
        this.pageNumber = pageNumber;
        this.path = Objects.requireNonNull(path, "path is required");
        this.mimeType = mimeType != null ? mimeType : mimeTypeFor(path);
    }

    public PageImage(int pageNumber, Path path) {
        this(pageNumber, path, null);
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public Path getPath() {
        return path;
    }

    public String getMimeType() {
        return mimeType;
    }

    public static String mimeTypeFor(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "image/png";
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        return "image/png";
    }

    @Override
    public String toString() {
        return "PageImage{page=" + pageNumber + ", path=" + path + "}";
    }
}
