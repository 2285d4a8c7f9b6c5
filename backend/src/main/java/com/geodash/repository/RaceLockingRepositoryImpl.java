package com.geodash.repository;

import com.geodash.model.Race;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class RaceLockingRepositoryImpl implements RaceLockingRepository {

    private static final Logger log = LoggerFactory.getLogger(RaceLockingRepositoryImpl.class);

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public boolean refreshForUpdate(Race race) {
        // The locked query returns the cached instance untouched, so the row is re-read afterwards.
        boolean exists = entityManager.createQuery("select r from Race r where r.raceId = :raceId", Race.class)
                .setParameter("raceId", race.getRaceId())
                .setLockMode(LockModeType.PESSIMISTIC_WRITE)
                .getResultList()
                .stream()
                .findFirst()
                .isPresent();
        if (!exists) {
            log.debug("Race {} was deleted before it could be locked", race.getRaceId());
            return false;
        }
        entityManager.refresh(race);
        return true;
    }
}
