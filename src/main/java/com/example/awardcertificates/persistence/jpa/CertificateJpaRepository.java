package com.example.awardcertificates.persistence.jpa;

import com.example.awardcertificates.model.CertificateStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CertificateJpaRepository extends JpaRepository<CertificateEntity, Long> {

    List<CertificateEntity> findBySubmitterAccountIdOrderByIdDesc(String submitterAccountId);

    List<CertificateEntity> findBySubmitterAccountIdAndStatusOrderByIdDesc(String submitterAccountId,
                                                                           CertificateStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CertificateEntity c where c.id = :id")
    Optional<CertificateEntity> findByIdForUpdate(@Param("id") Long id);
}
