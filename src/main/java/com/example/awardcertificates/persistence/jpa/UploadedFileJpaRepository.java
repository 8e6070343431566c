package com.example.awardcertificates.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UploadedFileJpaRepository extends JpaRepository<UploadedFileEntity, Long> {
}
