package com.geodash.repository;

import com.geodash.model.Race;

public interface RaceLockingRepository {

    /**
     * Takes the race row's write lock and reloads the managed race and its participants from the
     * database, discarding whatever this persistence context had cached.
     *
     * @return false when the race no longer exists
     */
    boolean refreshForUpdate(Race race);
}
