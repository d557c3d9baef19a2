package com.ledgerimport.domain;

/**
 * The one permitted mutation of a stored event.
 */
public interface EconomicEventRepositoryCustom {

    /**
     * Flag the event as superseded by a correction.
     *
     * @return false if the event does not exist or was already corrected
     */
    boolean markCorrected(String id);
}
