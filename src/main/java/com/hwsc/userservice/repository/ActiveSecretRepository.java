package com.hwsc.userservice.repository;

import com.hwsc.userservice.entity.ActiveSecret;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActiveSecretRepository extends JpaRepository<ActiveSecret, Integer> {
}
