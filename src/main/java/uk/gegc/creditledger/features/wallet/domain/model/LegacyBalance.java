package uk.gegc.creditledger.features.wallet.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Single-number balance read by older consumers. Mirrors subscription + top-up credits;
 * written only by {@code LegacyBalanceSync}.
 */
@Entity
@Table(name = "user_credits")
@Getter
@Setter
public class LegacyBalance {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "credits", nullable = false)
    private int credits;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
