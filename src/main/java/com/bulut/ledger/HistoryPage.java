package com.bulut.ledger;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of an address' transaction history, newest first.
 */
@Value
@Builder
public class HistoryPage {
    String address;
    int totalCount;
    int count;
    int offset;
    int limit;
    List<Transaction> transactions;
}
