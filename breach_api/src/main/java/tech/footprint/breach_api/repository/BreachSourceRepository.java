package tech.footprint.breach_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.footprint.breach_api.model.BreachSource;

import java.util.List;
import java.util.Optional;

public interface BreachSourceRepository extends JpaRepository<BreachSource, Long> {
    Optional<BreachSource> findByName(String name);

    List<BreachSource> findAllByOrderByPwnCountDesc();
}
