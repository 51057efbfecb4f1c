package com.hookledger.asset;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the asset descriptor.
 */
@Repository
interface AssetDescriptorRepository extends JpaRepository<AssetDescriptor, String> {

    Optional<AssetDescriptor> findFirstByOrderByCreatedAtAsc();

    /**
     * Load the descriptor row with a write lock held until the transaction ends.
     * Every balance or supply change takes this lock first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from AssetDescriptor d order by d.createdAt asc")
    List<AssetDescriptor> findAllForUpdate();
}
