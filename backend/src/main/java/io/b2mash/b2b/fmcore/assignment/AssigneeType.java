package io.b2mash.b2b.fmcore.assignment;

/** Kind of party a work order can be assigned to. */
public enum AssigneeType {
  /** An in-house technician; the assignee id is the technician's actor id. */
  USER,
  VENDOR
}
