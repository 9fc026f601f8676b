package com.copyradar.ingestion.classifier;

import com.copyradar.common.Addresses;
import com.copyradar.domain.PartyRole;
import com.copyradar.domain.PoolMetadata;
import com.copyradar.domain.SwapEvent;
import com.copyradar.domain.Trade;
import com.copyradar.domain.TradeDirection;
import com.copyradar.domain.TradeId;
import com.copyradar.domain.WatchedAccount;
import com.copyradar.ingestion.config.IngestionProperties;
import com.copyradar.ingestion.normalizer.AmountNormalizer;
import com.copyradar.reference.ReferenceData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one swap into zero, one or two trades: one per watched party (sender, recipient), each classified
 * independently. Stateless apart from the reference data passed in, so safe to run on any thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeExtractor {

    private static final int PRICE_SCALE = 18;

    private final DirectionClassifier directionClassifier;
    private final AmountNormalizer amountNormalizer;
    private final IngestionProperties ingestionProperties;

    public List<Trade> extract(SwapEvent swap, ReferenceData referenceData) {
        Optional<PoolMetadata> poolMeta = referenceData.pools().find(swap.poolId());
        if (poolMeta.isEmpty()) {
            log.warn("Unknown pool {}; dropping swap {}-{}", swap.poolId(), swap.transactionHash(), swap.logIndex());
            return List.of();
        }
        PoolMetadata pool = poolMeta.get();
        String sender = Addresses.normalize(swap.sender());
        String recipient = Addresses.normalize(swap.recipient());
        Optional<WatchedAccount> watchedSender = referenceData.watchedAccounts().find(sender);
        Optional<WatchedAccount> watchedRecipient = referenceData.watchedAccounts().find(recipient);
        if (watchedSender.isEmpty() && watchedRecipient.isEmpty()) {
            return List.of();
        }

        List<Trade> trades = new ArrayList<>(2);
        if (sender != null && sender.equals(recipient)) {
            // Same account on both sides: one trade, recipient view first since it names what was received.
            Optional<Trade> trade = tradeFor(swap, pool, watchedRecipient.get(), PartyRole.RECIPIENT, sender, recipient);
            if (trade.isEmpty()) {
                trade = tradeFor(swap, pool, watchedSender.get(), PartyRole.SENDER, sender, recipient);
            }
            trade.ifPresent(trades::add);
            return trades;
        }
        watchedSender.flatMap(a -> tradeFor(swap, pool, a, PartyRole.SENDER, sender, recipient))
                .ifPresent(trades::add);
        watchedRecipient.flatMap(a -> tradeFor(swap, pool, a, PartyRole.RECIPIENT, sender, recipient))
                .ifPresent(trades::add);
        return trades;
    }

    private Optional<Trade> tradeFor(SwapEvent swap, PoolMetadata pool, WatchedAccount account, PartyRole role,
                                     String sender, String recipient) {
        DirectionOutcome outcome = directionClassifier.classify(swap, pool, role);
        Optional<TradeDirection> direction = outcome.toTradeDirection();
        if (direction.isEmpty()) {
            log.debug("Indeterminate direction for {} ({}) as {} in {}-{}",
                    account.name(), account.address(), role, swap.transactionHash(), swap.logIndex());
            return Optional.empty();
        }
        BigDecimal baseAmount = amountNormalizer.normalizeAbs(pool.baseDelta(swap), pool.baseDecimals());
        BigDecimal quoteAmount = amountNormalizer.normalizeAbs(pool.quoteDelta(swap), pool.quoteDecimals());
        Trade trade = new Trade(
                new TradeId(swap.transactionHash(), swap.logIndex(), account.address()),
                swap.blockTimestamp(),
                swap.blockNumber(),
                ingestionProperties.getChain(),
                ingestionProperties.getProtocol(),
                account.address(),
                account.name(),
                role,
                direction.get(),
                baseAmount,
                quoteAmount,
                price(baseAmount, quoteAmount),
                pool.poolId(),
                pool.feeLabel(),
                sender,
                recipient,
                amountNormalizer.normalize(swap.amountA(), pool.tokenADecimals()),
                amountNormalizer.normalize(swap.amountB(), pool.tokenBDecimals()));
        return Optional.of(trade);
    }

    /** Quote per base; zero when no base moved. */
    static BigDecimal price(BigDecimal baseAmount, BigDecimal quoteAmount) {
        if (baseAmount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return quoteAmount.divide(baseAmount, PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
