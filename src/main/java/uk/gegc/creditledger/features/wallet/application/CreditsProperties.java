package uk.gegc.creditledger.features.wallet.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Credit ledger configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "credits")
@Validated
@Data
public class CreditsProperties {

    /**
     * Overdraft allowance given to a wallet when it is first created.
     * Grace is consumed, never replenished.
     */
    @PositiveOrZero
    private int defaultGraceLimit = 50;

    /**
     * Number of ledger entries returned by history queries when the caller gives no limit.
     */
    @Positive
    private int historyDefaultLimit = 50;

    /**
     * Hard cap for history queries.
     */
    @Positive
    private int historyMaxLimit = 200;

    /**
     * Cron for the ledger replay reconciliation job.
     */
    @NotBlank
    private String reconciliationCron = "0 0 2 * * SUN";

    @Valid
    private Api api = new Api();

    @Data
    public static class Api {
        @NotBlank
        private String username = "credits-reader";

        @NotBlank
        private String password = "change-me";

        @NotEmpty
        private List<String> authorities = new ArrayList<>(List.of("CREDITS_READ"));
    }
}
