package dev.valor.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Model} entities. */
public interface ModelRepository extends JpaRepository<Model, Long> {

  Optional<Model> findByName(String name);

  /**
   * Returns which of the given names are registered.
   *
   * @param names model names to look up
   * @return the subset of {@code names} that exist
   */
  @Query("SELECT m.name FROM Model m WHERE m.name IN :names")
  List<String> findExistingNames(@Param("names") Collection<String> names);
}
