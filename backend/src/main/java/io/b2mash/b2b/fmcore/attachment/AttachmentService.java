package io.b2mash.b2b.fmcore.attachment;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAccessService;
import io.b2mash.b2b.fmcore.workorder.WorkOrderAction;
import io.b2mash.b2b.fmcore.workorder.WorkOrderWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AttachmentService {

  private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

  private final WorkOrderAccessService accessService;
  private final WorkOrderWriter workOrderWriter;
  private final Clock clock;

  public AttachmentService(
      WorkOrderAccessService accessService, WorkOrderWriter workOrderWriter, Clock clock) {
    this.accessService = accessService;
    this.workOrderWriter = workOrderWriter;
    this.clock = clock;
  }

  /**
   * Appends a media item and returns the work order's full attachment list in upload order.
   * Duplicate URLs are accepted; several BEFORE photos of the same spot are normal.
   */
  @Transactional
  public List<Attachment> addAttachment(
      UUID workOrderId, ActorContext actor, AttachmentCategory category, String url) {
    var workOrder = accessService.requireAccess(workOrderId, actor, WorkOrderAction.ATTACH_MEDIA);
    Instant now = Instant.now(clock);
    workOrder.addAttachment(new Attachment(category, url, now, actor.actorId()));
    var saved = workOrderWriter.write(workOrder);

    log.info(
        "Attachment {} added to work order {} by {}", category, saved.getId(), actor.actorId());
    return saved.getAttachments();
  }

  @Transactional(readOnly = true)
  public List<Attachment> listAttachments(UUID workOrderId, ActorContext actor) {
    return accessService.requireAccess(workOrderId, actor, WorkOrderAction.VIEW).getAttachments();
  }
}
