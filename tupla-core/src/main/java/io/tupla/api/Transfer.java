package io.tupla.api;

import io.tupla.core.Actor;

/**
 * A table received through give away or inheritance.
 *
 * @param table     facade over the received table
 * @param gift      payload sent with the table (the heir payload for an inheritance)
 * @param from      previous owner
 * @param inherited true when the table passed on its owner's termination
 * @param <T>       facade type
 */
public record Transfer<T>(T table, Object gift, Actor from, boolean inherited) {
}
