package com.compliantvault.vaultservice.repository;

import com.compliantvault.vaultservice.model.OracleSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OracleSettingsRepository extends JpaRepository<OracleSettings, Long> {
}
