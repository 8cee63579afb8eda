package io.b2mash.b2b.fmcore.multitenancy;

import io.b2mash.b2b.fmcore.actor.ActorContext;
import io.b2mash.b2b.fmcore.exception.MissingOrganizationContextException;

/**
 * Request-bound caller identity. Bound by {@link TenantFilter} for the duration of the filter chain
 * and read by controllers.
 */
public final class RequestScopes {

  private static final ThreadLocal<ActorContext> ACTOR = new ThreadLocal<>();

  static void bind(ActorContext actor) {
    ACTOR.set(actor);
  }

  static void clear() {
    ACTOR.remove();
  }

  /** Returns the current actor. Throws if the filter chain did not bind one. */
  public static ActorContext requireActor() {
    ActorContext actor = ACTOR.get();
    if (actor == null) {
      throw new MissingOrganizationContextException();
    }
    return actor;
  }

  /** Returns the current actor, or null if not bound. */
  public static ActorContext getActorOrNull() {
    return ACTOR.get();
  }

  private RequestScopes() {}
}
