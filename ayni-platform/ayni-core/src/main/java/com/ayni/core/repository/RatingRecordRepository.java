package com.ayni.core.repository;

import com.ayni.core.domain.RatingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RatingRecordRepository extends JpaRepository<RatingRecord, UUID> {

    boolean existsByRaterAndSubjectAndSubjectDonationCount(String rater, String subject, long subjectDonationCount);
}
