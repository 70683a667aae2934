package com.gamebook.ingest;

import com.gamebook.AppLogger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Page text backed by a plain-text dump where each page starts with a {@code --- PAGE <i> ---} line.
 * Pages are 1-based and section {@code n} is printed on page {@code n + pageOffset}.
 */
public class PagedTextFileSource implements PageTextSource {

    private static final Pattern PAGE_MARKER = Pattern.compile("^---\\s*PAGE\\s+(\\d+)\\s*---\\s*$");

    private final Map<Integer, String> pages;
    private final int pageOffset;

    public PagedTextFileSource(Map<Integer, String> pages, int pageOffset) {
        this.pages = pages != null ? new LinkedHashMap<>(pages) : new LinkedHashMap<>();
        this.pageOffset = pageOffset;
    }

    public static PagedTextFileSource load(Path path, int pageOffset) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new FileNotFoundException("Missing page text source: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Map<Integer, String> pages = parse(content);
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[PagedTextFileSource] Loaded " + pages.size() + " pages from " + path);
        }
        return new PagedTextFileSource(pages, pageOffset);
    }

    /**
     * Split a page dump into page number to text. Text before the first marker is ignored.
     */
    public static Map<Integer, String> parse(String content) {
        Map<Integer, String> pages = new LinkedHashMap<>();
        if (content == null || content.isEmpty()) {
            return pages;
        }
        Integer current = null;
        StringBuilder buffer = new StringBuilder();
        for (String line : content.split("\\R", -1)) {
            Matcher m = PAGE_MARKER.matcher(line.trim());
            if (m.matches()) {
                if (current != null) {
                    pages.put(current, buffer.toString().strip());
                }
                current = Integer.parseInt(m.group(1));
                buffer.setLength(0);
                continue;
            }
            if (current != null) {
                buffer.append(line).append('\n');
            }
        }
        if (current != null) {
            pages.put(current, buffer.toString().strip());
        }
        return pages;
    }

    @Override
    public String textFor(int sectionNumber) {
        return pages.getOrDefault(sectionNumber + pageOffset, "");
    }

    public Map<Integer, String> getPages() {
        return Collections.unmodifiableMap(pages);
    }

    public int getPageOffset() {
        return pageOffset;
    }
}
