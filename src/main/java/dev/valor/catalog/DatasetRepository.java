package dev.valor.catalog;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Dataset} entities. */
public interface DatasetRepository extends JpaRepository<Dataset, Long> {

  Optional<Dataset> findByName(String name);
}
