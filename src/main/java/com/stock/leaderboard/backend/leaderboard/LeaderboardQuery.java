package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.exception.BadRequestException;

import java.util.Locale;

/**
 * 리더보드 조회 조건. 생성 시점에 검증이 끝난 값만 들고 있다.
 */
public record LeaderboardQuery(
        LeaderboardPeriod period,
        LeaderboardSortKey sortKey,
        SortOrder order,
        int page,
        int pageSize,
        String q,        // 소문자, 없으면 ""
        String sector    // 없으면 ""
) {

    public LeaderboardQuery {
        if (page < 1) {
            throw new BadRequestException("page", "page는 1 이상이어야 합니다.");
        }
        if (pageSize < 1) {
            throw new BadRequestException("pageSize", "pageSize는 1 이상이어야 합니다.");
        }
        q = q == null ? "" : q.trim().toLowerCase(Locale.ROOT);
        sector = sector == null ? "" : sector.trim();
    }

    public static LeaderboardQuery parse(
            String period,
            String sort,
            String order,
            Integer page,
            Integer pageSize,
            String q,
            String sector,
            LeaderboardProperties props
    ) {
        int size = pageSize == null ? props.getDefaultPageSize() : pageSize;
        if (size > props.getMaxPageSize()) {
            throw new BadRequestException("pageSize", "pageSize는 " + props.getMaxPageSize() + " 이하여야 합니다.");
        }

        return new LeaderboardQuery(
                LeaderboardPeriod.from(period),
                LeaderboardSortKey.from(sort),
                SortOrder.from(order),
                page == null ? 1 : page,
                size,
                q,
                sector
        );
    }

    public String cacheKey() {
        return String.join("|",
                period.code(),
                sortKey.code(),
                order.name(),
                String.valueOf(page),
                String.valueOf(pageSize),
                q,
                sector.toLowerCase(Locale.ROOT));
    }
}
