package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.TechnicianProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TechnicianProfileRepository extends JpaRepository<TechnicianProfile, UUID> {
}
