package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.VoteEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface IVoteRepository extends JpaRepository<VoteEntity, String> {

    boolean existsByPollIdAndVoterPubkey(String pollId, String voterPubkey);

    List<VoteEntity> findByPollIdOrderByVotedAtAscVoteIdAsc(String pollId);

    List<VoteEntity> findByVoterPubkeyOrderByVotedAtDescVoteIdDesc(String voterPubkey, Pageable pageable);

    /** Rows of {@code [choiceIndex, count]} for one poll. */
    @Query("SELECT v.choiceIndex, COUNT(v) FROM VoteEntity v WHERE v.pollId = :pollId GROUP BY v.choiceIndex")
    List<Object[]> countByChoice(@Param("pollId") String pollId);

    long countByPollId(String pollId);

    @Modifying
    @Query("DELETE FROM VoteEntity v WHERE v.pollId IN :ids")
    int deleteByPollIds(@Param("ids") Collection<String> ids);
}
