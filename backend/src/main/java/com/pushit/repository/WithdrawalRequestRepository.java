package com.pushit.repository;

import com.pushit.entity.WithdrawalRequest;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WithdrawalRequestRepository extends JpaRepository<WithdrawalRequest, Long> {

    List<WithdrawalRequest> findByInfluencerIdOrderByCreatedAtDesc(Long influencerId);
}
