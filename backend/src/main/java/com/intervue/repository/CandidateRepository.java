package com.intervue.repository;

import com.intervue.model.Candidate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CandidateRepository extends JpaRepository<Candidate, Integer> {
    boolean existsByEmailIgnoreCase(String email);
}
