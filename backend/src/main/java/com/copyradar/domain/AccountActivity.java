package com.copyradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-account daily rollup, keyed by (accountAddress, date).
 */
@NoArgsConstructor
@Getter
@Setter
public class AccountActivity extends TradeVolumeTally {

    private String accountAddress;
    private String accountName;
    private LocalDate date;
    private String chain;

    public AccountActivity(String accountAddress, String accountName, LocalDate date, String chain) {
        this.accountAddress = accountAddress;
        this.accountName = accountName;
        this.date = date;
        this.chain = chain;
    }

    public String getId() {
        return accountAddress + "-" + date;
    }

    /** Bought minus sold base; positive = net accumulation. */
    public BigDecimal getNetBasePosition() {
        return getTotalBuyBase().subtract(getTotalSellBase());
    }

    /** Quote received on sells minus quote spent on buys. */
    public BigDecimal getNetQuotePosition() {
        return getTotalSellQuote().subtract(getTotalBuyQuote());
    }

    public AccountActivity copy() {
        AccountActivity copy = new AccountActivity(accountAddress, accountName, date, chain);
        copyTallyInto(copy);
        return copy;
    }
}
