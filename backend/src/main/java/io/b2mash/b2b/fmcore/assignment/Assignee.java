package io.b2mash.b2b.fmcore.assignment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A technician or vendor registered to a tenant, as seen by dispatch. For {@link AssigneeType#USER}
 * the id is the technician's actor id, so ability checks can match the assignment to the caller.
 * Ids are unique per tenant only: a vendor serving several tenants holds one row in each.
 */
@Entity
@Table(name = "assignees")
@IdClass(AssigneeKey.class)
public class Assignee {

  @Id
  @Column(name = "tenant_id", nullable = false, updatable = false)
  private String tenantId;

  @Id
  @Column(name = "id", nullable = false, updatable = false)
  private String id;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private AssigneeType type;

  @Column(name = "name", nullable = false)
  private String name;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "skills", columnDefinition = "jsonb", nullable = false)
  private List<String> skills = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "availability", nullable = false, length = 20)
  private Availability availability;

  @Column(name = "current_workload", nullable = false)
  private int currentWorkload;

  @Column(name = "max_workload", nullable = false)
  private int maxWorkload;

  @Column(name = "rating", precision = 3, scale = 2)
  private BigDecimal rating;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  protected Assignee() {}

  public Assignee(
      String id,
      String tenantId,
      AssigneeType type,
      String name,
      List<String> skills,
      Availability availability,
      int currentWorkload,
      int maxWorkload,
      BigDecimal rating) {
    this.id = id;
    this.tenantId = tenantId;
    this.type = type;
    this.name = name;
    this.skills = skills != null ? new ArrayList<>(skills) : new ArrayList<>();
    this.availability = availability;
    this.currentWorkload = currentWorkload;
    this.maxWorkload = maxWorkload;
    this.rating = rating;
  }

  /** Counts one more open work order against this assignee. */
  void takeOn() {
    currentWorkload++;
  }

  void release() {
    if (currentWorkload > 0) {
      currentWorkload--;
    }
  }

  public String getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public AssigneeType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public List<String> getSkills() {
    return Collections.unmodifiableList(skills);
  }

  public Availability getAvailability() {
    return availability;
  }

  public int getCurrentWorkload() {
    return currentWorkload;
  }

  public int getMaxWorkload() {
    return maxWorkload;
  }

  public BigDecimal getRating() {
    return rating;
  }

  public int getVersion() {
    return version;
  }
}
