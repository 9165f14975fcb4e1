package com.distributedsystems.archon.repository;

import com.distributedsystems.archon.model.BindingEntity;
import com.distributedsystems.archon.model.BindingKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IBindingRepository extends JpaRepository<BindingEntity, String> {

    List<BindingEntity> findByDidOrderByCreatedAtDesc(String did);

    List<BindingEntity> findByDidAndKindAndSupersededAtIsNull(String did, BindingKind kind);

    long countByDidAndKindAndSupersededAtIsNull(String did, BindingKind kind);
}
