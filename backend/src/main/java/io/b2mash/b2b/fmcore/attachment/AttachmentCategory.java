package io.b2mash.b2b.fmcore.attachment;

public enum AttachmentCategory {
  BEFORE,
  AFTER,
  OTHER
}
