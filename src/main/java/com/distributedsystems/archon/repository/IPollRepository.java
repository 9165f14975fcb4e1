package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.PollEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface IPollRepository extends JpaRepository<PollEntity, String> {

    long countByDeadlineGreaterThan(long nowSeconds);

    long countByDeadlineLessThanEqual(long nowSeconds);

    /** Closed polls, oldest deadline first. */
    @Query("SELECT p.pollId FROM PollEntity p WHERE p.deadline <= :now ORDER BY p.deadline ASC, p.createdAt ASC")
    List<String> findClosedPollIds(@Param("now") long nowSeconds, Pageable pageable);

    @Query("SELECT p.pollId FROM PollEntity p WHERE p.deadline <= :now AND p.deadline < :cutoff ORDER BY p.deadline ASC")
    List<String> findClosedPollIdsBefore(@Param("now") long nowSeconds, @Param("cutoff") long cutoff);

    @Modifying
    @Query("DELETE FROM PollEntity p WHERE p.pollId IN :ids")
    int deleteByPollIds(@Param("ids") Collection<String> ids);
}
