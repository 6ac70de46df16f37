package com.replymail.mapper;

import com.replymail.domain.DocumentChunk;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface DocumentChunkMapper {

    void insertAll(@Param("chunks") List<DocumentChunk> chunks);

    List<DocumentChunk> findAll();

    List<DocumentChunk> findByDocumentId(@Param("documentId") String documentId);

    int count();

    int deleteByDocumentId(@Param("documentId") String documentId);

    int deleteByChunkIds(@Param("chunkIds") List<String> chunkIds);
}
