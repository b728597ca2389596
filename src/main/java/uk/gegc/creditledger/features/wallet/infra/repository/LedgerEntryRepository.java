package uk.gegc.creditledger.features.wallet.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.util.List;
import java.util.UUID;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findByUserIdOrderByIdDesc(UUID userId, Pageable pageable);

    List<LedgerEntry> findByUserIdOrderByIdAsc(UUID userId);

    List<LedgerEntry> findByUserIdAndPoolOrderByIdAsc(UUID userId, WalletPool pool);

    List<LedgerEntry> findBySourceIdOrderByIdAsc(String sourceId);

    long countByUserId(UUID userId);
}
