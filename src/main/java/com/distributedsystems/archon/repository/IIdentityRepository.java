package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.IdentityEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IIdentityRepository extends JpaRepository<IdentityEntity, String> {

    Optional<IdentityEntity> findByDid(String did);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM IdentityEntity i WHERE i.nodePubkey = :nodePubkey")
    Optional<IdentityEntity> findForUpdate(@Param("nodePubkey") String nodePubkey);
}
