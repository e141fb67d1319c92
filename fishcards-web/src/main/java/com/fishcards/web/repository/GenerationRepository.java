package com.fishcards.web.repository;

import com.fishcards.web.entity.GenerationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface GenerationRepository extends CrudRepository<GenerationEntity, Long> {

    List<GenerationEntity> findByUserId(String userId, Pageable pageable);

    long countByUserId(String userId);

    Optional<GenerationEntity> findByIdAndUserId(Long id, String userId);
}
