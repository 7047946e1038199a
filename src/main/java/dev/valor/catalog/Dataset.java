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
 * A named collection of datums. Datums, annotations and labels are written by the ingestion
 * collaborator; this service only reads them through compiled filters.
 */
@Entity
@Table(name = "datasets")
public class Dataset {

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

  protected Dataset() {
    // JPA requires no-arg constructor
  }

  public Dataset(String name, String meta) {
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
