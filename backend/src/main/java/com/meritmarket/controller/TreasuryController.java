package com.meritmarket.controller;

import com.meritmarket.dto.ResolutionRequests;
import com.meritmarket.service.ResolutionProtocol;
import com.meritmarket.service.TreasuryLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Treasury balances and protocol fee withdrawal.
 */
@RestController
@RequestMapping("/api/treasury")
public class TreasuryController {

    private final ResolutionProtocol resolutionProtocol;

    public TreasuryController(ResolutionProtocol resolutionProtocol) {
        this.resolutionProtocol = resolutionProtocol;
    }

    @GetMapping
    public ResponseEntity<TreasuryLedgerService.TreasurySnapshot> getTreasury() {
        return ResponseEntity.ok(resolutionProtocol.treasury());
    }

    @PostMapping("/fees/withdrawals")
    public ResponseEntity<TreasuryLedgerService.TreasurySnapshot> withdrawFees(
            @Valid @RequestBody ResolutionRequests.WithdrawFeesRequest request
    ) {
        return ResponseEntity.ok(resolutionProtocol.withdrawProtocolFees(
                request.caller(), request.recipient(), request.amount()));
    }
}
