package vpnmanager.adapter.in.dto;

import java.util.List;
import java.util.function.Function;

import vpnmanager.core.model.certificate.Page;

/**
 * DTO for one page of a listing.
 */
public record PageDto<T>(List<T> items, int page, int pageSize, long totalItems, long totalPages, boolean hasNext) {

    public static <M, T> PageDto<T> fromModel(Page<M> page, Function<M, T> mapper) {
        return new PageDto<>(
                page.items().stream().map(mapper).toList(),
                page.page(),
                page.size(),
                page.totalItems(),
                page.totalPages(),
                page.hasNext());
    }
}
