package uk.gegc.creditledger.features.wallet.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.wallet.api.dto.LedgerEntryDto;
import uk.gegc.creditledger.features.wallet.api.dto.WalletBalanceDto;
import uk.gegc.creditledger.features.wallet.application.LedgerReconciliationService;
import uk.gegc.creditledger.features.wallet.application.WalletService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/credits/users/{userId}")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Read-only wallet balances and ledger history")
@SecurityRequirement(name = "basicAuth")
public class WalletController {

    private final WalletService walletService;
    private final LedgerReconciliationService reconciliationService;

    @Operation(summary = "Get a user's balance", description = "Subscription, top-up and grace state. Requires CREDITS_READ.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance",
                    content = @Content(schema = @Schema(implementation = WalletBalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_READ")
    })
    @GetMapping("/balance")
    @PreAuthorize("hasAuthority('CREDITS_READ')")
    public ResponseEntity<WalletBalanceDto> getBalance(@PathVariable UUID userId) {
        return ResponseEntity.ok(walletService.getBalance(userId));
    }

    @Operation(summary = "List ledger entries", description = "Newest first. Requires CREDITS_READ.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ledger entries",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = LedgerEntryDto.class)))),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Missing CREDITS_READ")
    })
    @GetMapping("/transactions")
    @PreAuthorize("hasAuthority('CREDITS_READ')")
    public ResponseEntity<List<LedgerEntryDto>> getTransactions(
            @PathVariable UUID userId,
            @Parameter(description = "Maximum number of entries; defaults to credits.history-default-limit")
            @RequestParam(name = "limit", defaultValue = "0") int limit) {
        return ResponseEntity.ok(walletService.getTransactionHistory(userId, limit));
    }

    @Operation(summary = "Replay a user's ledger", description = "Compares replayed pool balances with stored ones. Requires CREDITS_READ.")
    @GetMapping("/reconciliation")
    @PreAuthorize("hasAuthority('CREDITS_READ')")
    public ResponseEntity<LedgerReconciliationService.ReconciliationResult> reconcile(@PathVariable UUID userId) {
        return ResponseEntity.ok(reconciliationService.reconcileUser(userId));
    }
}
