package io.b2mash.b2b.fmcore.assignment;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AssigneeRepository extends JpaRepository<Assignee, AssigneeKey> {

  Optional<Assignee> findByIdAndTenantId(String id, String tenantId);

  List<Assignee> findByTenantIdAndAvailabilityNot(String tenantId, Availability availability);
}
