package io.github.riemr.availability.infrastructure.mapper;

import io.github.riemr.availability.infrastructure.persistence.entity.TimeOffRow;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface TimeOffMapper {
    TimeOffRow selectByPrimaryKey(@Param("id") Long id);

    List<TimeOffRow> selectByProvider(@Param("providerId") String providerId);

    int insert(TimeOffRow row);

    int deleteByPrimaryKey(@Param("id") Long id);
}
