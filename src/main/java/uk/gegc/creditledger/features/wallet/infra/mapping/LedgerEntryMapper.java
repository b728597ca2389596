package uk.gegc.creditledger.features.wallet.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.wallet.api.dto.LedgerEntryDto;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LedgerEntryMapper {
    LedgerEntryDto toDto(LedgerEntry entity);
    List<LedgerEntryDto> toDtos(List<LedgerEntry> entities);
}
