package uk.gegc.creditledger.features.wallet.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WalletRepository extends JpaRepository<Wallet, UUID> {

    Optional<Wallet> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);

    /**
     * Row lock ({@code SELECT ... FOR UPDATE}) held until the surrounding transaction ends.
     * Serializes every read-modify-write on one user's wallet.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.userId = :userId")
    Optional<Wallet> findByUserIdForUpdate(@Param("userId") UUID userId);

    /**
     * Creates the wallet unless a concurrent transaction already did.
     *
     * @return 1 when this call inserted the row, 0 when it already existed
     */
    @Modifying
    @Query(value = """
            INSERT IGNORE INTO wallets
                (user_id, subscription_credits, top_up_credits, subscription_expires_at,
                 grace_limit, grace_used, version, created_at, updated_at)
            VALUES (:userId, 0, :topUpCredits, NULL, :graceLimit, 0, 0, :now, :now)
            """, nativeQuery = true)
    int insertIfAbsent(@Param("userId") UUID userId,
                       @Param("topUpCredits") int topUpCredits,
                       @Param("graceLimit") int graceLimit,
                       @Param("now") LocalDateTime now);

    @Query("SELECT w.userId FROM Wallet w ORDER BY w.userId")
    List<UUID> findAllUserIds();
}
