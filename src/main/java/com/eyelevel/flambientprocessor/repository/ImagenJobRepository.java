package com.eyelevel.flambientprocessor.repository;

import com.eyelevel.flambientprocessor.model.ImagenJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link ImagenJob} entity.
 */
@Repository
public interface ImagenJobRepository extends JpaRepository<ImagenJob, String> {

    /**
     * Finds jobs whose id starts with the given prefix, so operators can type a short id.
     *
     * @param prefix The leading characters of the job id.
     * @return all matching jobs; more than one means the prefix is ambiguous.
     */
    List<ImagenJob> findByIdStartingWith(String prefix);

    /**
     * Most recently created jobs first.
     */
    List<ImagenJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ImagenJob> findByParentJobId(String parentJobId);
}
