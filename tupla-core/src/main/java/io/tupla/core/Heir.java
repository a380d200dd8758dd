package io.tupla.core;

/**
 * Actor that inherits a table when its owner terminates, with the payload it receives.
 *
 * @param actor   the heir, null for {@link #NONE}
 * @param payload delivered to the heir on inheritance
 */
public record Heir(Actor actor, Object payload) {

    public static final Heir NONE = new Heir(null, null);

    public static Heir of(Actor actor, Object payload) {
        if (actor == null) {
            throw new IllegalArgumentException("actor required");
        }
        return new Heir(actor, payload);
    }

    public boolean isNone() {
        return actor == null;
    }

    @Override
    public String toString() {
        return isNone() ? "none" : actor.toString();
    }
}
