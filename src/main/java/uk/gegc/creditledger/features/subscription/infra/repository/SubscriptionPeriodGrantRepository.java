package uk.gegc.creditledger.features.subscription.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.creditledger.features.subscription.domain.model.SubscriptionPeriodGrant;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionPeriodGrantRepository extends JpaRepository<SubscriptionPeriodGrant, Long> {

    boolean existsBySubscriptionIdAndPeriodStart(String subscriptionId, LocalDateTime periodStart);

    Optional<SubscriptionPeriodGrant> findBySubscriptionIdAndPeriodStart(String subscriptionId, LocalDateTime periodStart);

    List<SubscriptionPeriodGrant> findByUserIdOrderByPeriodStartDesc(UUID userId);
}
