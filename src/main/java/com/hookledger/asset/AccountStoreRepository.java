package com.hookledger.asset;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for account store persistence.
 */
@Repository
interface AccountStoreRepository extends JpaRepository<AccountStore, String> {

    Optional<AccountStore> findByOwnerAndAssetId(String owner, String assetId);

    @Query("select coalesce(sum(s.balance), 0) from AccountStore s where s.assetId = :assetId")
    long sumBalances(@Param("assetId") String assetId);
}
