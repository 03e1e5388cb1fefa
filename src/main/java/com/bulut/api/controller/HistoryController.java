package com.bulut.api.controller;

import com.bulut.common.exception.ErrorCode;
import com.bulut.common.exception.NotFoundException;
import com.bulut.ledger.HistoryPage;
import com.bulut.ledger.Transaction;
import com.bulut.ledger.TransactionLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the transaction ledger.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "History", description = "Transaction history API")
public class HistoryController {

    private final TransactionLedger ledger;

    @GetMapping("/history/{address}")
    @Operation(summary = "Get transaction history for an address, newest first")
    public ResponseEntity<HistoryPage> getHistory(@PathVariable String address,
                                                  @RequestParam(defaultValue = "50") int limit,
                                                  @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(ledger.history(address, limit, offset));
    }

    @GetMapping("/transaction/{hash}")
    @Operation(summary = "Get a transaction by its hash")
    public ResponseEntity<Transaction> getTransaction(@PathVariable String hash) {
        Transaction transaction = ledger.getByHash(hash)
            .orElseThrow(() -> new NotFoundException(ErrorCode.TRANSACTION_NOT_FOUND, "transaction " + hash));
        return ResponseEntity.ok(transaction);
    }
}
