package com.rsfleet.repairs.repository;

import com.rsfleet.repairs.model.CustomerPricingProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CustomerPricingProfileRepository extends JpaRepository<CustomerPricingProfile, UUID> {

    Optional<CustomerPricingProfile> findByCustomerId(UUID customerId);
}
