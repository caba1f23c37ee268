package io.condoinsight.warehouse.repository;

import io.condoinsight.warehouse.entity.ProjectLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProjectLocationRepository extends JpaRepository<ProjectLocation, Long> {

    Optional<ProjectLocation> findByProjectName(String projectName);
}
