package com.machina.provisioning.controller;

import com.machina.provisioning.exception.ValidationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

final class Paging {

    static final int MAX_PER_PAGE = 100;

    private Paging() {
    }

    /**
     * @param page 1-based page number from the query string
     */
    static Pageable of(int page, int perPage, Sort sort) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1", "page");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new ValidationException("per_page must be between 1 and " + MAX_PER_PAGE, "per_page");
        }
        return PageRequest.of(page - 1, perPage, sort);
    }
}
