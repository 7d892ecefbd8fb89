package com.jiracdc.source;

import com.jiracdc.core.model.IssueRecord;

import java.util.List;

/**
 * One page of a paginated issue search.
 *
 * @param items      issues on this page
 * @param totalCount total matches across all pages
 * @param pageOffset offset of the first item
 * @param pageSize   requested page size
 */
public record SearchPage(
    List<IssueRecord> items,
    int totalCount,
    int pageOffset,
    int pageSize
) {

    public boolean isLast() {
        return items.isEmpty() || pageOffset + items.size() >= totalCount;
    }
}
