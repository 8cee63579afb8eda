package io.b2mash.b2b.fmcore.assignment;

import java.io.Serializable;
import java.util.Objects;

/** Primary key of {@link Assignee}: the owning tenant plus the tenant-scoped assignee id. */
public class AssigneeKey implements Serializable {

  private String tenantId;
  private String id;

  public AssigneeKey() {}

  public AssigneeKey(String tenantId, String id) {
    this.tenantId = tenantId;
    this.id = id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getId() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AssigneeKey other)) {
      return false;
    }
    return Objects.equals(tenantId, other.tenantId) && Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tenantId, id);
  }

  @Override
  public String toString() {
    return tenantId + "/" + id;
  }
}
