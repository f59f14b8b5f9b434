package com.stock.leaderboard.backend.market.provider;

import java.time.LocalDate;
import java.util.List;

/**
 * 외부 시세 provider. 어떤 구현이 쓰일지는 {@code market.provider} 설정으로 고른다.
 * <p>
 * 전송 오류, 2xx 가 아닌 응답, 쓸 수 없는 본문은 모두 {@link QuoteProviderException} 으로 던진다.
 * 데이터가 없다는 정상 응답은 빈 리스트로 돌려준다.
 */
public interface QuoteProvider {

    String name();

    ProviderQuote getQuote(String symbol);

    List<DailyClose> getHistoricalRange(String symbol, LocalDate from, LocalDate to);

    List<DividendPayment> getDividends(String symbol, LocalDate from, LocalDate to);
}
