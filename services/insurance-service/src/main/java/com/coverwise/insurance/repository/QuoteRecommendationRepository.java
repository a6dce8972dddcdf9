package com.coverwise.insurance.repository;

import com.coverwise.insurance.entity.QuoteRecommendation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface QuoteRecommendationRepository extends JpaRepository<QuoteRecommendation, UUID> {

    List<QuoteRecommendation> findByApplicationIdOrderByRecommendationRankAsc(UUID applicationId);

    /**
     * Bulk delete so the old ranks are gone before the new rows are inserted.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM QuoteRecommendation r WHERE r.application.id = :applicationId")
    int deleteByApplicationId(@Param("applicationId") UUID applicationId);
}
