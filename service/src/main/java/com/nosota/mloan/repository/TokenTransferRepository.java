package com.nosota.mloan.repository;

import com.nosota.mloan.model.TokenTransferEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TokenTransferRepository extends JpaRepository<TokenTransferEntry, Long> {

    List<TokenTransferEntry> findAllByOrderByIdAsc();

    List<TokenTransferEntry> findAllByToIdentityOrderByIdAsc(String toIdentity);
}
