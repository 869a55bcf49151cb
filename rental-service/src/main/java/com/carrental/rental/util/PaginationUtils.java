package com.carrental.rental.util;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.PageResponse;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Collections;
import java.util.List;

public final class PaginationUtils {

    private PaginationUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static <T> PageResponse<T> paginate(List<T> allResults, int page, int size) {
        int normalizedPage = normalizePageNumber(page);
        int normalizedSize = normalizePageSize(size);

        int totalElements = allResults.size();
        int totalPages = (int) Math.ceil((double) totalElements / normalizedSize);

        int fromIndex = (int) Math.min((long) normalizedPage * normalizedSize, totalElements);
        int toIndex = Math.min(fromIndex + normalizedSize, totalElements);

        List<T> pageContent = (fromIndex < totalElements)
                ? List.copyOf(allResults.subList(fromIndex, toIndex))
                : Collections.emptyList();

        return PageResponse.<T>builder()
                .content(pageContent)
                .page(normalizedPage)
                .size(normalizedSize)
                .totalElements(totalElements)
                .totalPages(totalPages)
                .first(normalizedPage == 0)
                .last(normalizedPage >= totalPages - 1)
                .hasNext(normalizedPage < totalPages - 1)
                .hasPrevious(normalizedPage > 0)
                .build();
    }

    public static Pageable pageable(int page, int size, Sort sort) {
        return PageRequest.of(normalizePageNumber(page), normalizePageSize(size), sort);
    }

    public static int normalizePageNumber(int page) {
        return Math.max(0, page);
    }

    public static int normalizePageSize(int size) {
        return Math.min(Math.max(1, size), RentalConstants.MAX_PAGE_SIZE);
    }
}
