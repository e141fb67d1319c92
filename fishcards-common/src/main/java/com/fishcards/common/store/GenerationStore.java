package com.fishcards.common.store;

import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.exception.PersistenceException;

/**
 * 生成流水线的持久化协作方，只做插入。
 */
public interface GenerationStore {

    /**
     * 插入一条生成记录，返回带主键与创建时间的记录。
     *
     * @throws PersistenceException 写库失败
     */
    GenerationRecord insertGeneration(GenerationRecord record);

    /**
     * 插入一条错误日志。调用方按尽力而为处理失败。
     */
    void insertErrorLog(ErrorLogEntry entry);
}
