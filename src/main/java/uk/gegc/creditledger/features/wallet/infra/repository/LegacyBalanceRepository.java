package uk.gegc.creditledger.features.wallet.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.wallet.domain.model.LegacyBalance;

import java.util.UUID;

public interface LegacyBalanceRepository extends JpaRepository<LegacyBalance, UUID> {
}
