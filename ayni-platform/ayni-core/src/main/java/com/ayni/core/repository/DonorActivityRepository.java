package com.ayni.core.repository;

import com.ayni.core.domain.DonorActivity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DonorActivityRepository extends JpaRepository<DonorActivity, String> {
}
