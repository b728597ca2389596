package uk.gegc.creditledger.features.wallet.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.wallet.api.dto.WalletBalanceDto;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface WalletMapper {
    WalletBalanceDto toDto(Wallet entity);
}
