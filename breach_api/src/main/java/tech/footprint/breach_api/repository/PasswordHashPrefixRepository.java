package tech.footprint.breach_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.footprint.breach_api.model.PasswordHashPrefix;

import java.util.List;
import java.util.Optional;

public interface PasswordHashPrefixRepository extends JpaRepository<PasswordHashPrefix, Long> {
    List<PasswordHashPrefix> findByPrefixOrderBySuffixAsc(String prefix);

    Optional<PasswordHashPrefix> findByPrefixAndSuffix(String prefix, String suffix);
}
