package com.tony.powerRank.repository;

import com.tony.powerRank.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface TeamRepository extends JpaRepository<Team, String> {

    List<Team> findByIdIn(Collection<String> ids);
}
