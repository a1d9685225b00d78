package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.WatchStatus;

import java.util.List;
import java.util.Optional;

public interface WatchRepository extends JpaRepository<Watch, Long> {
    Optional<Watch> findBySerialNumber(String serialNumber);

    boolean existsBySerialNumber(String serialNumber);

    List<Watch> findByStatus(WatchStatus status);

    List<Watch> findByOwnerId(Long ownerId);
}
