package io.b2mash.b2b.fmcore.assignment;

public enum Availability {
  AVAILABLE,
  BUSY,
  OFFLINE
}
