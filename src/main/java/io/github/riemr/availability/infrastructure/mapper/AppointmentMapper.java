package io.github.riemr.availability.infrastructure.mapper;

import io.github.riemr.availability.infrastructure.persistence.entity.AppointmentRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface AppointmentMapper {
    List<AppointmentRow> selectByProviderAndPeriod(@Param("providerId") String providerId,
                                                   @Param("from") LocalDateTime from,
                                                   @Param("to") LocalDateTime to);
}
