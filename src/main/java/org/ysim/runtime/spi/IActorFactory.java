package org.ysim.runtime.spi;

import org.ysim.runtime.model.Actor;

/**
 * Generates fresh actors with profile attributes, at population initialization and recruitment.
 */
public interface IActorFactory {

    /**
     * @param id        id reserved for the actor
     * @param joinedDay day the actor joins
     * @param random    source for all profile draws
     */
    Actor createUser(long id, int joinedDay, IRandomProvider random);

    /**
     * @param id     id reserved for the page
     * @param index  position of the page in the configured page list
     * @param random source for all profile draws
     */
    Actor createPage(long id, int index, IRandomProvider random);
}
