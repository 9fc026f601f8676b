package com.copyradar.ingestion.classifier;

import com.copyradar.domain.PartyRole;
import com.copyradar.domain.PoolMetadata;
import com.copyradar.domain.SwapEvent;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Infers BUY/SELL for one party of a pool swap. Pool deltas: positive = paid out of the pool to the recipient,
 * negative = paid into the pool by the sender. Only the base/quote role matters, not token0/token1 order.
 * <ul>
 *   <li>RECIPIENT: base &gt; 0 → BUY (received base); else quote &gt; 0 → SELL (received quote)</li>
 *   <li>SENDER: base &lt; 0 → SELL (gave base); else quote &lt; 0 → BUY (gave quote)</li>
 *   <li>anything else → INDETERMINATE</li>
 * </ul>
 */
@Component
public class DirectionClassifier {

    public DirectionOutcome classify(SwapEvent swap, PoolMetadata pool, PartyRole role) {
        BigInteger base = pool.baseDelta(swap);
        BigInteger quote = pool.quoteDelta(swap);
        if (role == PartyRole.RECIPIENT) {
            if (base.signum() > 0) {
                return DirectionOutcome.BUY;
            }
            if (quote.signum() > 0) {
                return DirectionOutcome.SELL;
            }
        } else if (role == PartyRole.SENDER) {
            if (base.signum() < 0) {
                return DirectionOutcome.SELL;
            }
            if (quote.signum() < 0) {
                return DirectionOutcome.BUY;
            }
        }
        return DirectionOutcome.INDETERMINATE;
    }
}
