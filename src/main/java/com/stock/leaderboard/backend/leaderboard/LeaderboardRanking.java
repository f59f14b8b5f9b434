package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.leaderboard.dto.LeaderboardEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 필터 → 정렬 → 순위 → 페이지 자르기.
 * <p>
 * 정렬은 안정 정렬이라 값이 같으면 입력 순서(포트폴리오 id 순)를 그대로 유지한다.
 * 순위는 필터가 적용된 목록 안에서의 1부터 시작하는 위치다.
 */
final class LeaderboardRanking {

    private LeaderboardRanking() {
    }

    static List<LeaderboardEntry> filter(List<LeaderboardEntry> entries, String q, String sector) {
        String needle = q == null ? "" : q.trim().toLowerCase(Locale.ROOT);
        String sectorFilter = sector == null ? "" : sector.trim();

        List<LeaderboardEntry> out = new ArrayList<>();
        for (LeaderboardEntry e : entries) {
            if (!needle.isEmpty() && !contains(e.username(), needle) && !contains(e.displayName(), needle)) {
                continue;
            }
            if (!sectorFilter.isEmpty() && !sectorFilter.equalsIgnoreCase(e.primarySector())) {
                continue;
            }
            out.add(e);
        }
        return out;
    }

    static List<LeaderboardEntry> sort(List<LeaderboardEntry> entries, LeaderboardSortKey key, SortOrder order) {
        Comparator<LeaderboardEntry> cmp = Comparator.comparing(
                (LeaderboardEntry e) -> key.valueOf(e.metrics()),
                BigDecimal::compareTo
        );
        if (order == SortOrder.DESC) {
            cmp = cmp.reversed();
        }

        List<LeaderboardEntry> sorted = new ArrayList<>(entries);
        sorted.sort(cmp);
        return sorted;
    }

    static List<LeaderboardEntry> assignRanks(List<LeaderboardEntry> sorted) {
        List<LeaderboardEntry> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return ranked;
    }

    // [(page-1)*pageSize, page*pageSize)
    static List<LeaderboardEntry> slice(List<LeaderboardEntry> ranked, int page, int pageSize) {
        long from = (long) (page - 1) * pageSize;
        if (from >= ranked.size()) return List.of();
        int to = (int) Math.min(from + pageSize, ranked.size());
        return List.copyOf(ranked.subList((int) from, to));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
