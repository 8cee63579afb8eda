package io.b2mash.b2b.fmcore.workorder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.fmcore.exception.ResourceConflictException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
class WorkOrderWriterTest {

  @Mock private WorkOrderRepository workOrderRepository;
  @InjectMocks private WorkOrderWriter writer;

  @Test
  void returns_saved_entity() {
    var workOrder = TestWorkOrders.reported("org_acme");
    when(workOrderRepository.saveAndFlush(workOrder)).thenReturn(workOrder);

    assertThat(writer.write(workOrder)).isSameAs(workOrder);
  }

  @Test
  void version_mismatch_becomes_conflict() {
    var workOrder = TestWorkOrders.reported("org_acme");
    when(workOrderRepository.saveAndFlush(workOrder))
        .thenThrow(new ObjectOptimisticLockingFailureException(WorkOrder.class, workOrder.getId()));

    assertThatThrownBy(() -> writer.write(workOrder))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("modified concurrently");
  }
}
