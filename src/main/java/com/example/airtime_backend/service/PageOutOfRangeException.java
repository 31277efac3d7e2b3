package com.example.airtime_backend.service;

/**
 * Requested timeline page starts at or after the end of the resolved range.
 */
public class PageOutOfRangeException extends RuntimeException {
    private final int page;
    private final int totalPages;

    public PageOutOfRangeException(int page, int totalPages) {
        super("Page " + page + " is out of range (total pages: " + totalPages + ")");
        this.page = page;
        this.totalPages = totalPages;
    }

    public int getPage() {
        return page;
    }

    public int getTotalPages() {
        return totalPages;
    }
}
