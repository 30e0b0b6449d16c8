package com.vidnyan.sketch.application.port.out;

import com.vidnyan.sketch.domain.model.BoardMemoryProfile;

import java.util.List;

/**
 * Port for board memory profiles supplied from outside the built-in table.
 */
public interface BoardProfileRepository {

    /**
     * All additional profiles; empty when none are configured.
     */
    List<BoardMemoryProfile> findAll();
}
