package com.replymail.mapper;

import com.replymail.domain.ProcessedRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ProcessedRecordMapper {

    /**
     * INSERT OR IGNORE - returns 0 when the id was already present
     */
    int insertIfAbsent(ProcessedRecord record);

    int existsById(@Param("messageId") String messageId);

    List<ProcessedRecord> findAll();

    int count();

    int deleteAll();
}
