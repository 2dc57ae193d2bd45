package com.feetrail.api.dto;

import com.feetrail.ingestion.query.DistributionPage;

import java.util.List;

/**
 * Paginated distribution listing: {data[], pagination{limit, offset, count, hasMore}}.
 */
public record DistributionPageResponse(List<FeeDistributionResponse> data, Pagination pagination) {

    public record Pagination(int limit, int offset, int count, boolean hasMore) {}

    public static DistributionPageResponse from(DistributionPage page) {
        List<FeeDistributionResponse> data = page.items().stream().map(FeeDistributionResponse::from).toList();
        return new DistributionPageResponse(data,
                new Pagination(page.limit(), page.offset(), data.size(), page.hasMore()));
    }
}
