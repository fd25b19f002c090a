package com.hwsc.userservice.repository;

import com.hwsc.userservice.entity.Secret;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecretRepository extends JpaRepository<Secret, String> {
}
