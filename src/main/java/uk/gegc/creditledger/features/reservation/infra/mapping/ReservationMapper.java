package uk.gegc.creditledger.features.reservation.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creditledger.features.reservation.api.dto.ReservationDto;
import uk.gegc.creditledger.features.reservation.domain.model.Reservation;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ReservationMapper {
    ReservationDto toDto(Reservation entity);
    List<ReservationDto> toDtos(List<Reservation> entities);
}
