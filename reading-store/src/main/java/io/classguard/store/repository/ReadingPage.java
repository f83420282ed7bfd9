package io.classguard.store.repository;

import io.classguard.store.model.Reading;

import java.util.List;

/**
 * One page of readings, newest first. Pages are numbered from 1.
 */
public final class ReadingPage {

    private final List<Reading> items;
    private final int page;
    private final int pageSize;
    private final long totalItems;

    public ReadingPage(List<Reading> items, int page, int pageSize, long totalItems) {
        this.items = List.copyOf(items);
        this.page = page;
        this.pageSize = pageSize;
        this.totalItems = totalItems;
    }

    public static ReadingPage empty(int page, int pageSize) {
        return new ReadingPage(List.of(), page, pageSize, 0);
    }

    public List<Reading> getItems() { return items; }
    public int getPage() { return page; }
    public int getPageSize() { return pageSize; }
    public long getTotalItems() { return totalItems; }

    public int totalPages() {
        if (pageSize <= 0 || totalItems == 0) {
            return 0;
        }
        return (int) ((totalItems + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page >= 1 && page < totalPages();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
