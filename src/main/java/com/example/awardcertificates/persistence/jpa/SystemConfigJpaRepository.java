package com.example.awardcertificates.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SystemConfigJpaRepository extends JpaRepository<SystemConfigEntity, String> {
}
