package dev.valor.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A named model whose predictions are stored as annotations with a {@code model_id}. Models are
 * registered by the catalog collaborator; evaluations only check that the names they reference
 * exist.
 */
@Entity
@Table(name = "models")
public class Model {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true)
  private String name;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "meta", columnDefinition = "JSONB", nullable = false)
  private String meta = "{}";

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Model() {
    // JPA requires no-arg constructor
  }

  public Model(String name, String meta) {
    this.name = name;
    this.meta = meta;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getMeta() {
    return meta;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
