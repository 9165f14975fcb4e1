package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.DidHistoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IDidHistoryRepository extends JpaRepository<DidHistoryEntity, String> {

    List<DidHistoryEntity> findByNodePubkeyOrderByGenerationAsc(String nodePubkey);
}
