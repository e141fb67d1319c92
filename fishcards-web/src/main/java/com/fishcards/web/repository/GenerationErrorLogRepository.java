package com.fishcards.web.repository;

import com.fishcards.web.entity.GenerationErrorLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface GenerationErrorLogRepository extends CrudRepository<GenerationErrorLogEntity, Long> {

    List<GenerationErrorLogEntity> findByUserId(String userId, Pageable pageable);

    long countByUserId(String userId);
}
