package com.intervue.repository;

import com.intervue.model.PackItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PackItemRepository extends JpaRepository<PackItem, Integer> {
    List<PackItem> findByPackIdOrderBySortOrderAsc(Integer packId);

    boolean existsByQuestionId(UUID questionId);

    boolean existsByPackIdAndQuestionId(Integer packId, UUID questionId);
}
