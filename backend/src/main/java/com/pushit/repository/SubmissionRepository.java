package com.pushit.repository;

import com.pushit.entity.Submission;
import com.pushit.entity.SubmissionStatus;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    boolean existsByCampaignIdAndInfluencerId(Long campaignId, Long influencerId);

    List<Submission> findByInfluencerIdOrderBySubmittedAtDesc(Long influencerId);

    List<Submission> findByStatusOrderBySubmittedAtAsc(SubmissionStatus status);
}
