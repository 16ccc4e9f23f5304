package tech.footprint.breach_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import tech.footprint.breach_api.model.BreachSource;
import tech.footprint.breach_api.model.BreachedEmail;

import java.util.List;

public interface BreachedEmailRepository extends JpaRepository<BreachedEmail, Long> {

    boolean existsByEmailHashAndBreachSource(String emailHash, BreachSource breachSource);

    @Query("select e.breachSource from BreachedEmail e where e.emailHash = :emailHash order by e.breachSource.pwnCount desc")
    List<BreachSource> findSourcesByEmailHash(@Param("emailHash") String emailHash);
}
