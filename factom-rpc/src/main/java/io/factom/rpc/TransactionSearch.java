// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filter for the wallet {@code transactions} call.
 *
 * <p>Exactly one of three mutually exclusive searches is sent:
 * <ul>
 * <li>{@link ById} - {@code {"txid": ...}}, the fastest lookup, which reports no height</li>
 * <li>{@link ByAddress} - {@code {"address": ...}}, every transaction touching the address</li>
 * <li>{@link ByRange} - {@code {"range": {"start": ..., "end": ...}}}, a block height range</li>
 * </ul>
 */
public sealed interface TransactionSearch
        permits TransactionSearch.ById, TransactionSearch.ByAddress, TransactionSearch.ByRange {

    static TransactionSearch byId(final String txid) {
        return new ById(txid);
    }

    static TransactionSearch byAddress(final String address) {
        return new ByAddress(address);
    }

    static TransactionSearch byRange(final long start, final long end) {
        return new ByRange(start, end);
    }

    /**
     * Writes this search into the request params.
     *
     * @param params the params being built
     */
    void applyTo(RpcParams params);

    record ById(String txid) implements TransactionSearch {

        public ById {
            Objects.requireNonNull(txid, "txid");
        }

        @Override
        public void applyTo(final RpcParams params) {
            params.put("txid", txid);
        }
    }

    record ByAddress(String address) implements TransactionSearch {

        public ByAddress {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public void applyTo(final RpcParams params) {
            params.put("address", address);
        }
    }

    record ByRange(long start, long end) implements TransactionSearch {

        @Override
        public void applyTo(final RpcParams params) {
            final Map<String, Object> range = new LinkedHashMap<>();
            range.put("start", start);
            range.put("end", end);
            params.put("range", range);
        }
    }
}
