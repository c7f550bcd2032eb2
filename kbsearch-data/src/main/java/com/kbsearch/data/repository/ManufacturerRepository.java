package com.kbsearch.data.repository;

import com.kbsearch.data.entity.Manufacturer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ManufacturerRepository extends JpaRepository<Manufacturer, UUID> {
    
    Optional<Manufacturer> findBySlug(String slug);
}
