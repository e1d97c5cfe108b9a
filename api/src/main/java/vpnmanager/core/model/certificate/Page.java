package vpnmanager.core.model.certificate;

import java.util.List;

/**
 * One page of results.
 *
 * @param items items on this page, empty when the page is past the end
 * @param page 1-based page number actually served
 * @param size page size actually applied
 * @param totalItems number of items matching the query across all pages
 */
public record Page<T>(List<T> items, int page, int size, long totalItems) {

    public Page {
        items = List.copyOf(items);
    }

    public long totalPages() {
        return totalItems == 0 ? 0 : (totalItems + size - 1) / size;
    }

    public boolean hasNext() {
        return page < totalPages();
    }

    /**
     * Slices an already filtered and sorted list.
     */
    public static <T> Page<T> slice(List<T> all, PageRequest request) {
        final long offset = request.offset();
        if (offset >= all.size()) {
            return new Page<>(List.of(), request.page(), request.size(), all.size());
        }
        final int from = (int) offset;
        final int to = (int) Math.min(all.size(), offset + request.size());
        return new Page<>(all.subList(from, to), request.page(), request.size(), all.size());
    }
}
