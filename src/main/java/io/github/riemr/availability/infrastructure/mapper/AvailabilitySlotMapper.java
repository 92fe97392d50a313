package io.github.riemr.availability.infrastructure.mapper;

import io.github.riemr.availability.infrastructure.persistence.entity.AvailabilitySlotRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AvailabilitySlotMapper {
    AvailabilitySlotRow selectByPrimaryKey(@Param("id") Long id);

    List<AvailabilitySlotRow> selectByProvider(@Param("providerId") String providerId);

    int insert(AvailabilitySlotRow row);

    int deleteByPrimaryKey(@Param("id") Long id);
}
